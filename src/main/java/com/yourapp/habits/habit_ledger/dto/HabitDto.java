package com.yourapp.habits.habit_ledger.dto;

import com.yourapp.habits.habit_ledger.model.Habit;

import java.time.Instant;

public record HabitDto(Long id, Long ownerId, String name, String description, String timeZone, Instant createdAt) {

    public static HabitDto from(Habit habit) {
        return new HabitDto(habit.getId(), habit.getOwnerId(), habit.getName(), habit.getDescription(),
                habit.getTimeZone(), habit.getCreatedAt());
    }
}
