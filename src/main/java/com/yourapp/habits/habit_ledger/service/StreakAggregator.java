package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.dto.HabitReport;
import com.yourapp.habits.habit_ledger.dto.LifetimeStats;
import com.yourapp.habits.habit_ledger.dto.MonthlyStats;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.Habit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Streak and progress statistics derived from the completion ledger. Read-only and
 * recomputed on every call; nothing is cached between calls.
 */
@Service
@RequiredArgsConstructor
public class StreakAggregator {

    private final LedgerService ledger;
    private final Clock clock;

    /**
     * Consecutive completed days ending at {@code asOf} (inclusive). A skipped or missing
     * day breaks the streak.
     */
    public int currentStreak(Long habitId, LocalDate asOf) {
        Habit habit = ledger.requireHabit(habitId);
        return scan(habit, asOf, YearMonth.from(asOf)).currentStreak();
    }

    /**
     * Longest run of consecutive completed days in the habit's history.
     */
    public int bestStreak(Long habitId) {
        Habit habit = ledger.requireHabit(habitId);
        LocalDate today = today(habit);
        return scan(habit, today, YearMonth.from(today)).bestStreak;
    }

    public MonthlyStats monthlyStats(Long habitId, YearMonth month) {
        Habit habit = ledger.requireHabit(habitId);
        return scan(habit, today(habit), month).monthly();
    }

    /**
     * Month statistics as seen on {@code today}; days after {@code today} and before the
     * habit was created do not count as elapsed.
     */
    public MonthlyStats monthlyStats(Long habitId, YearMonth month, LocalDate today) {
        Habit habit = ledger.requireHabit(habitId);
        return scan(habit, today, month).monthly();
    }

    public LifetimeStats lifetimeStats(Long habitId) {
        Habit habit = ledger.requireHabit(habitId);
        LocalDate today = today(habit);
        return scan(habit, today, YearMonth.from(today)).lifetime();
    }

    public LifetimeStats lifetimeStats(Long habitId, LocalDate today) {
        Habit habit = ledger.requireHabit(habitId);
        return scan(habit, today, YearMonth.from(today)).lifetime();
    }

    public HabitReport report(Long habitId) {
        Habit habit = ledger.requireHabit(habitId);
        LocalDate today = today(habit);
        LedgerScan scan = scan(habit, today, YearMonth.from(today));
        return new HabitReport(habit.getId(), habit.getName(), today,
            scan.currentStreak(), scan.bestStreak, scan.lastCompleted,
            scan.monthly(), scan.lifetime());
    }

    private LocalDate today(Habit habit) {
        return LocalDate.now(clock.withZone(habit.getZoneId()));
    }

    private LedgerScan scan(Habit habit, LocalDate asOf, YearMonth month) {
        LedgerScan scan = new LedgerScan(habit.getCreatedDate(), asOf, month);
        scan.accept(ledger.completionsOf(habit.getId()));
        return scan;
    }

    /**
     * Single pass over records sorted by date, collecting every number the reports need.
     */
    static final class LedgerScan {
        private final LocalDate createdDate;
        private final LocalDate asOf;
        private final YearMonth month;
        private final LocalDate monthFrom;
        private final LocalDate monthTo;

        private int run;
        private LocalDate runEnd;
        int bestStreak;
        LocalDate lastCompleted;
        int monthCompleted;
        int lifetimeCompleted;

        LedgerScan(LocalDate createdDate, LocalDate asOf, YearMonth month) {
            this.createdDate = createdDate;
            this.asOf = asOf;
            this.month = month;
            this.monthFrom = later(month.atDay(1), createdDate);
            this.monthTo = earlier(month.atEndOfMonth(), asOf);
        }

        void accept(List<CompletionRecord> ordered) {
            for (CompletionRecord record : ordered) {
                LocalDate day = record.getRecordDate();
                if (day.isAfter(asOf)) {
                    break;
                }
                if (!record.isCompleted()) {
                    run = 0;
                    runEnd = null;
                    continue;
                }
                run = runEnd != null && runEnd.plusDays(1).equals(day) ? run + 1 : 1;
                runEnd = day;
                bestStreak = Math.max(bestStreak, run);
                lastCompleted = day;
                if (!day.isBefore(monthFrom) && !day.isAfter(monthTo)) {
                    monthCompleted++;
                }
                if (!day.isBefore(createdDate)) {
                    lifetimeCompleted++;
                }
            }
        }

        int currentStreak() {
            return asOf.equals(runEnd) ? run : 0;
        }

        MonthlyStats monthly() {
            int elapsed = daysInclusive(monthFrom, monthTo);
            return new MonthlyStats(month, monthCompleted, elapsed, ratio(monthCompleted, elapsed));
        }

        LifetimeStats lifetime() {
            int total = daysInclusive(createdDate, asOf);
            return new LifetimeStats(lifetimeCompleted, total, ratio(lifetimeCompleted, total));
        }

        private static int daysInclusive(LocalDate from, LocalDate to) {
            return from.isAfter(to) ? 0 : (int) ChronoUnit.DAYS.between(from, to) + 1;
        }

        private static double ratio(int part, int whole) {
            return whole == 0 ? 0.0 : (double) part / whole;
        }

        private static LocalDate later(LocalDate a, LocalDate b) {
            return a.isAfter(b) ? a : b;
        }

        private static LocalDate earlier(LocalDate a, LocalDate b) {
            return a.isBefore(b) ? a : b;
        }
    }
}
