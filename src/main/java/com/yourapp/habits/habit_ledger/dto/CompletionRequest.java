package com.yourapp.habits.habit_ledger.dto;

public record CompletionRequest(String outcome) {
}
