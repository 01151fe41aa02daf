package com.yourapp.habits.habit_ledger.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "completion_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_completion_habit_date",
                columnNames = {"habit_id", "record_date"}))
public class CompletionRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "habit_id", nullable = false)
    private Habit habit;

    @Column(name = "record_date", nullable = false)
    private LocalDate recordDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Outcome outcome;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public CompletionRecord() {
    }

    public CompletionRecord(Habit habit, LocalDate recordDate, Outcome outcome, Instant recordedAt) {
        this.habit = habit;
        this.recordDate = recordDate;
        this.outcome = outcome;
        this.recordedAt = recordedAt;
    }

    public Long getId() {
        return id;
    }

    public Habit getHabit() {
        return habit;
    }

    public void setHabit(Habit habit) {
        this.habit = habit;
    }

    public LocalDate getRecordDate() {
        return recordDate;
    }

    public void setRecordDate(LocalDate recordDate) {
        this.recordDate = recordDate;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(Instant recordedAt) {
        this.recordedAt = recordedAt;
    }

    @Override
    public String toString() {
        return "CompletionRecord{" +
                "id=" + id +
                ", habit=" + (habit != null ? habit.getId() : "null") +
                ", recordDate=" + recordDate +
                ", outcome=" + outcome +
                ", recordedAt=" + recordedAt +
                '}';
    }
}
