package com.yourapp.habits.habit_ledger.dto;

import java.time.YearMonth;

public record MonthlyStats(YearMonth month, int completedDays, int totalDaysElapsed, double percentage) {
}
