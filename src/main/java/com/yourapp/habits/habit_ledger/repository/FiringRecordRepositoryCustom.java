package com.yourapp.habits.habit_ledger.repository;

import java.time.Instant;
import java.time.LocalDate;

public interface FiringRecordRepositoryCustom {

    /**
     * Inserts a firing record unless one exists for the same schedule and date.
     *
     * @return true if this call inserted the row
     */
    boolean insertIfAbsent(Long scheduleId, LocalDate firedDate, Instant claimedAt);
}
