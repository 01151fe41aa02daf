package com.yourapp.habits.habit_ledger.dto;

import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Schedule;

import java.time.LocalDate;

/**
 * A schedule whose prompt should be sent for {@code dueDate} (local to the schedule's zone).
 */
public record DueSchedule(Schedule schedule, Habit habit, LocalDate dueDate) {

    public Long scheduleId() {
        return schedule.getId();
    }

    public Long habitId() {
        return habit.getId();
    }
}
