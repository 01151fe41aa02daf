package com.yourapp.habits.habit_ledger.model;

/**
 * Result of trying to insert a firing record.
 */
public enum FiringClaim {
    /**
     * This caller inserted the record and owns the delivery
     */
    CLAIMED,

    /**
     * A record for the schedule and date already exists; nothing to deliver
     */
    ALREADY_HANDLED
}
