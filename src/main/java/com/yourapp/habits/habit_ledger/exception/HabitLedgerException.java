package com.yourapp.habits.habit_ledger.exception;

/**
 * Base type for errors raised by the ledger core.
 */
public class HabitLedgerException extends RuntimeException {

    public HabitLedgerException(String message) {
        super(message);
    }

    public HabitLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
