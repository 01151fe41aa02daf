package com.yourapp.habits.habit_ledger.dto;

import java.time.LocalDate;

/**
 * Per-habit numbers a report or chart needs, computed in one pass.
 */
public record HabitReport(Long habitId,
                          String habitName,
                          LocalDate asOf,
                          int currentStreak,
                          int bestStreak,
                          LocalDate lastCompleted,
                          MonthlyStats thisMonth,
                          LifetimeStats lifetime) {
}
