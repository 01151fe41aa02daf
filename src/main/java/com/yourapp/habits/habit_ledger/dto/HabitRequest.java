package com.yourapp.habits.habit_ledger.dto;

public record HabitRequest(Long ownerId, String name, String description, String timeZone) {
}
