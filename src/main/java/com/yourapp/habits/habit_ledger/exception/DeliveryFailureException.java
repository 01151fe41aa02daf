package com.yourapp.habits.habit_ledger.exception;

/**
 * Transient failure to hand a prompt to the messaging platform.
 * The dispatch loop retries on its next tick.
 */
public class DeliveryFailureException extends HabitLedgerException {

    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
