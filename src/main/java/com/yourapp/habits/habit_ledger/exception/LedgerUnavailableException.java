package com.yourapp.habits.habit_ledger.exception;

public class LedgerUnavailableException extends HabitLedgerException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
