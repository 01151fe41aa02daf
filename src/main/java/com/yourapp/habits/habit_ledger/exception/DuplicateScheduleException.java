package com.yourapp.habits.habit_ledger.exception;

import java.time.LocalTime;

public class DuplicateScheduleException extends HabitLedgerException {

    public DuplicateScheduleException(Long habitId, LocalTime timeOfDay) {
        super("Habit " + habitId + " already has an active schedule at " + timeOfDay);
    }
}
