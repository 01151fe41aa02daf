package com.yourapp.habits.habit_ledger.dto;

public record TickReport(int due, int delivered, int failed, int alreadyHandled, int alreadyCompleted) {

    public static TickReport empty() {
        return new TickReport(0, 0, 0, 0, 0);
    }
}
