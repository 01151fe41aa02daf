package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.exception.InvalidDateException;
import com.yourapp.habits.habit_ledger.exception.NotFoundException;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CompletionRecorderTest {

    private static final Instant NOW = Instant.parse("2026-10-17T22:30:00Z");

    private LedgerService ledger;
    private Habit habit;
    private CompletionRecorder recorder;

    @BeforeEach
    void setUp() {
        ledger = mock(LedgerService.class);
        habit = new Habit(7L, "Run", null, "UTC");
        habit.setId(1L);
        when(ledger.requireHabit(1L)).thenReturn(habit);
        when(ledger.upsertCompletion(eq(habit), any(), any(), any()))
            .thenAnswer(inv -> new CompletionRecord(habit, inv.getArgument(1), inv.getArgument(2), inv.getArgument(3)));

        recorder = new CompletionRecorder(ledger, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRecordOutcomeForPastOrPresentDate() {
        CompletionRecord saved = recorder.record(1L, LocalDate.of(2026, 10, 17), Outcome.COMPLETED);

        assertEquals(Outcome.COMPLETED, saved.getOutcome());
        assertEquals(NOW, saved.getRecordedAt());
        verify(ledger).upsertCompletion(habit, LocalDate.of(2026, 10, 17), Outcome.COMPLETED, NOW);
    }

    @Test
    void shouldRejectFutureDate() {
        assertThrows(InvalidDateException.class,
            () -> recorder.record(1L, LocalDate.of(2026, 10, 18), Outcome.COMPLETED));
        verify(ledger, never()).upsertCompletion(any(), any(), any(), any());
    }

    @Test
    void shouldJudgeFutureInOwnerTimeZone() {
        // 22:30 UTC is already the 18th in Tokyo
        habit.setTimeZone("Asia/Tokyo");

        CompletionRecord saved = recorder.record(1L, LocalDate.of(2026, 10, 18), Outcome.SKIPPED);

        assertEquals(LocalDate.of(2026, 10, 18), saved.getRecordDate());
    }

    @Test
    void shouldRetryOnceAfterConcurrentInsert() {
        when(ledger.upsertCompletion(eq(habit), any(), any(), any()))
            .thenThrow(new DataIntegrityViolationException("uk_completion_habit_date"))
            .thenAnswer(inv -> new CompletionRecord(habit, inv.getArgument(1), inv.getArgument(2), inv.getArgument(3)));

        CompletionRecord saved = recorder.record(1L, LocalDate.of(2026, 10, 16), Outcome.SKIPPED);

        assertEquals(Outcome.SKIPPED, saved.getOutcome());
        verify(ledger, times(2)).upsertCompletion(habit, LocalDate.of(2026, 10, 16), Outcome.SKIPPED, NOW);
    }

    @Test
    void shouldParseChatAnswer() {
        CompletionRecord saved = recorder.recordAnswer(1L, LocalDate.of(2026, 10, 15), "no");

        assertEquals(Outcome.SKIPPED, saved.getOutcome());
    }

    @Test
    void shouldRejectUnknownAnswerBeforeTouchingLedger() {
        assertThrows(IllegalArgumentException.class,
            () -> recorder.recordAnswer(1L, LocalDate.of(2026, 10, 15), "perhaps"));
        verify(ledger, never()).upsertCompletion(any(), any(), any(), any());
    }

    @Test
    void shouldRecordTodayInOwnerZone() {
        CompletionRecord saved = recorder.recordToday(1L, Outcome.COMPLETED);

        assertEquals(LocalDate.of(2026, 10, 17), saved.getRecordDate());
    }

    @Test
    void shouldPropagateUnknownHabit() {
        when(ledger.requireHabit(5L)).thenThrow(NotFoundException.habit(5L));

        assertThrows(NotFoundException.class,
            () -> recorder.record(5L, LocalDate.of(2026, 10, 17), Outcome.COMPLETED));
    }
}
