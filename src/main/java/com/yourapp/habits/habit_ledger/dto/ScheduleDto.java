package com.yourapp.habits.habit_ledger.dto;

import com.yourapp.habits.habit_ledger.model.Schedule;

import java.time.LocalTime;

public record ScheduleDto(Long id, Long habitId, LocalTime timeOfDay, String timeZone, boolean active) {

    public static ScheduleDto from(Schedule schedule, Long habitId) {
        return new ScheduleDto(schedule.getId(), habitId, schedule.getTimeOfDay(),
                schedule.getTimeZone(), schedule.isActive());
    }
}
