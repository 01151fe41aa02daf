package com.yourapp.habits.habit_ledger.dto;

import java.time.LocalDate;
import java.time.LocalTime;

public record DueScheduleDto(Long scheduleId, Long habitId, String habitName, LocalTime timeOfDay,
                             String timeZone, LocalDate dueDate) {

    public static DueScheduleDto from(DueSchedule due) {
        return new DueScheduleDto(due.scheduleId(), due.habitId(), due.habit().getName(),
                due.schedule().getTimeOfDay(), due.schedule().getTimeZone(), due.dueDate());
    }
}
