package com.yourapp.habits.habit_ledger.dto;

import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.Outcome;

import java.time.Instant;
import java.time.LocalDate;

public record CompletionDto(Long habitId, LocalDate date, Outcome outcome, Instant recordedAt) {

    public static CompletionDto from(CompletionRecord record) {
        return new CompletionDto(record.getHabit().getId(), record.getRecordDate(),
                record.getOutcome(), record.getRecordedAt());
    }
}
