package com.yourapp.habits.habit_ledger.exception;

public class NotFoundException extends HabitLedgerException {

    public NotFoundException(String kind, Long id) {
        super(kind + " not found with id: " + id);
    }

    public static NotFoundException habit(Long id) {
        return new NotFoundException("Habit", id);
    }

    public static NotFoundException schedule(Long id) {
        return new NotFoundException("Schedule", id);
    }
}
