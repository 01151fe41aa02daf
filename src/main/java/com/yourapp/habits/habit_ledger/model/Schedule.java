package com.yourapp.habits.habit_ledger.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

@Entity
@Table(name = "schedule")
public class Schedule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "habit_id", nullable = false)
    private Habit habit;

    @Column(name = "time_of_day", nullable = false)
    private LocalTime timeOfDay;

    // zone the time of day is interpreted in
    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone;

    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Schedule() {
    }

    public Schedule(Habit habit, LocalTime timeOfDay, String timeZone) {
        this.habit = habit;
        this.timeOfDay = timeOfDay;
        this.timeZone = timeZone;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Habit getHabit() {
        return habit;
    }

    public void setHabit(Habit habit) {
        this.habit = habit;
    }

    public LocalTime getTimeOfDay() {
        return timeOfDay;
    }

    public void setTimeOfDay(LocalTime timeOfDay) {
        this.timeOfDay = timeOfDay;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public ZoneId getZoneId() {
        return ZoneId.of(timeZone != null ? timeZone : "UTC");
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.timeZone == null && habit != null) {
            this.timeZone = habit.getTimeZone();
        }
    }

    @Override
    public String toString() {
        return "Schedule{" +
                "id=" + id +
                ", habit=" + (habit != null ? habit.getId() : "null") +
                ", timeOfDay=" + timeOfDay +
                ", timeZone='" + timeZone + '\'' +
                ", active=" + active +
                '}';
    }
}
