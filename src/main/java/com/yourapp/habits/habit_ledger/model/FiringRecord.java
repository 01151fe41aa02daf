package com.yourapp.habits.habit_ledger.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Marks that the prompt of a schedule was dispatched for one local date.
 * The row is inserted as a claim before delivery; {@code deliveredAt} is set once the
 * platform accepted the prompt. At most one row exists per (schedule, date).
 */
@Entity
@Table(name = "firing_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_firing_schedule_date",
                columnNames = {"schedule_id", "fired_date"}))
public class FiringRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "schedule_id", nullable = false)
    private Schedule schedule;

    @Column(name = "fired_date", nullable = false)
    private LocalDate firedDate;

    @Column(name = "claimed_at", nullable = false)
    private Instant claimedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    public FiringRecord() {
    }

    public Long getId() {
        return id;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public LocalDate getFiredDate() {
        return firedDate;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public boolean isDelivered() {
        return deliveredAt != null;
    }

    @Override
    public String toString() {
        return "FiringRecord{" +
                "id=" + id +
                ", schedule=" + (schedule != null ? schedule.getId() : "null") +
                ", firedDate=" + firedDate +
                ", deliveredAt=" + deliveredAt +
                '}';
    }
}
