package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.exception.InvalidDateException;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * The only write path into the completion ledger. One record per (habit, date); a later
 * answer for the same day replaces the earlier one.
 */
@Service
public class CompletionRecorder {
    private static final Logger logger = LoggerFactory.getLogger(CompletionRecorder.class);

    private final LedgerService ledger;
    private final Clock clock;

    @Autowired
    public CompletionRecorder(LedgerService ledger, Clock clock) {
        this.ledger = ledger;
        this.clock = clock;
    }

    /**
     * Records the outcome of a habit for a date.
     *
     * @throws com.yourapp.habits.habit_ledger.exception.NotFoundException if the habit does not exist
     * @throws InvalidDateException if the date is after today in the owner's time zone
     */
    public CompletionRecord record(Long habitId, LocalDate date, Outcome outcome) {
        if (date == null || outcome == null) {
            throw new IllegalArgumentException("Date and outcome must not be null");
        }
        Habit habit = ledger.requireHabit(habitId);
        LocalDate today = LocalDate.now(clock.withZone(habit.getZoneId()));
        if (date.isAfter(today)) {
            throw new InvalidDateException(date, today);
        }

        Instant now = clock.instant();
        CompletionRecord saved;
        try {
            saved = ledger.upsertCompletion(habit, date, outcome, now);
        } catch (DataIntegrityViolationException e) {
            // another writer inserted the same (habit, date) first; overwrite it
            logger.debug("Concurrent completion for habit {} on {}, retrying as update", habitId, date);
            saved = ledger.upsertCompletion(habit, date, outcome, now);
        }
        logger.info("Recorded {} for habit {} on {}", outcome, habitId, date);
        return saved;
    }

    public CompletionRecord recordToday(Long habitId, Outcome outcome) {
        Habit habit = ledger.requireHabit(habitId);
        return record(habitId, LocalDate.now(clock.withZone(habit.getZoneId())), outcome);
    }

    /**
     * Records a raw chat answer such as "yes" or "skipped".
     *
     * @throws IllegalArgumentException if the answer is not a known outcome
     */
    public CompletionRecord recordAnswer(Long habitId, LocalDate date, String answer) {
        return record(habitId, date, Outcome.fromAnswer(answer));
    }
}
