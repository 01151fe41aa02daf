package com.yourapp.habits.habit_ledger.exception;

import java.time.LocalDate;

public class InvalidDateException extends HabitLedgerException {

    public InvalidDateException(LocalDate date, LocalDate today) {
        super("Date " + date + " is in the future (today is " + today + ")");
    }
}
