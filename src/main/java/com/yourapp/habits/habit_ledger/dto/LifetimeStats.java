package com.yourapp.habits.habit_ledger.dto;

public record LifetimeStats(int completedDays, int totalDays, double percentage) {
}
