package com.yourapp.habits.habit_ledger.dto;

import java.time.LocalTime;

public record ScheduleRequest(LocalTime timeOfDay, String timeZone) {
}
