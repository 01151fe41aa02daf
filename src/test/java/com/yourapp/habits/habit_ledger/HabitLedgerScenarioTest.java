package com.yourapp.habits.habit_ledger;

import com.yourapp.habits.habit_ledger.dto.DueSchedule;
import com.yourapp.habits.habit_ledger.dto.HabitReport;
import com.yourapp.habits.habit_ledger.dto.TickReport;
import com.yourapp.habits.habit_ledger.exception.DuplicateScheduleException;
import com.yourapp.habits.habit_ledger.exception.InvalidDateException;
import com.yourapp.habits.habit_ledger.exception.NotFoundException;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.FiringClaim;
import com.yourapp.habits.habit_ledger.model.FiringRecord;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Outcome;
import com.yourapp.habits.habit_ledger.model.Schedule;
import com.yourapp.habits.habit_ledger.repository.CompletionRecordRepository;
import com.yourapp.habits.habit_ledger.repository.FiringRecordRepository;
import com.yourapp.habits.habit_ledger.repository.HabitRepository;
import com.yourapp.habits.habit_ledger.repository.ScheduleRepository;
import com.yourapp.habits.habit_ledger.config.DispatchProperties;
import com.yourapp.habits.habit_ledger.scheduler.DispatchLoop;
import com.yourapp.habits.habit_ledger.service.CompletionRecorder;
import com.yourapp.habits.habit_ledger.service.LedgerService;
import com.yourapp.habits.habit_ledger.service.PromptDelivery;
import com.yourapp.habits.habit_ledger.service.ScheduleClock;
import com.yourapp.habits.habit_ledger.service.StreakAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@SpringBootTest
class HabitLedgerScenarioTest {

    private static final Instant START = Instant.parse("2026-10-17T06:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2026, 10, 17);

    @TestConfiguration
    static class ClockOverride {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MutableClock clock;
    @SpyBean
    private LedgerService ledger;
    @Autowired
    private ScheduleClock scheduleClock;
    @Autowired
    private DispatchLoop dispatchLoop;
    @Autowired
    private CompletionRecorder recorder;
    @Autowired
    private StreakAggregator aggregator;
    @Autowired
    private DispatchProperties properties;
    @Autowired
    private HabitRepository habitRepository;
    @Autowired
    private ScheduleRepository scheduleRepository;
    @Autowired
    private FiringRecordRepository firingRepository;
    @Autowired
    private CompletionRecordRepository completionRepository;

    @MockBean
    private PromptDelivery delivery;

    private Habit habit;
    private Schedule schedule;

    @BeforeEach
    void setUp() {
        for (Habit existing : habitRepository.findAll()) {
            ledger.deleteHabit(existing.getId());
        }
        clock.set(START);
        habit = ledger.createHabit(1001L, "Stretch", "five minutes", "UTC");
        schedule = ledger.addSchedule(habit.getId(), LocalTime.of(9, 0), null);
        when(delivery.deliver(any(), any(), any())).thenReturn(true);
    }

    @Test
    void shouldPromptOncePerDayAfterTimeOfDay() {
        clock.set(Instant.parse("2026-10-17T08:59:00Z"));
        assertTrue(scheduleClock.dueSchedules(clock.instant()).isEmpty());

        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        List<DueSchedule> due = scheduleClock.dueSchedules(clock.instant());
        assertEquals(1, due.size());
        assertEquals(schedule.getId(), due.get(0).scheduleId());

        TickReport first = dispatchLoop.runTick();
        assertEquals(1, first.delivered());
        verify(delivery, times(1)).deliver(any(), any(), eq(DAY));

        FiringRecord record = firingRepository.findByScheduleIdAndFiredDate(schedule.getId(), DAY).orElseThrow();
        assertTrue(record.isDelivered());

        clock.set(Instant.parse("2026-10-17T09:05:00Z"));
        assertTrue(scheduleClock.dueSchedules(clock.instant()).isEmpty());
        assertEquals(0, dispatchLoop.runTick().delivered());
        verify(delivery, times(1)).deliver(any(), any(), any());

        clock.set(Instant.parse("2026-10-18T09:01:00Z"));
        List<DueSchedule> nextDay = scheduleClock.dueSchedules(clock.instant());
        assertEquals(1, nextDay.size());
        assertEquals(DAY.plusDays(1), nextDay.get(0).dueDate());
    }

    @Test
    void shouldNotResendAfterRestart() {
        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        dispatchLoop.runTick();

        DispatchLoop restarted = new DispatchLoop(scheduleClock, ledger, delivery, properties, clock);
        try {
            assertEquals(0, restarted.runTick().delivered());
        } finally {
            restarted.shutdown();
        }
        verify(delivery, times(1)).deliver(any(), any(), any());
    }

    @Test
    void shouldNotResendWhenConfirmationFailsOnce() {
        doThrow(new IllegalStateException("lock wait timeout"))
            .doCallRealMethod()
            .when(ledger).confirmFiring(any(), any(), any());

        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        assertEquals(1, dispatchLoop.runTick().delivered());
        assertFalse(firingRepository.findByScheduleIdAndFiredDate(schedule.getId(), DAY).orElseThrow().isDelivered());

        // past the claim ttl
        clock.set(Instant.parse("2026-10-17T09:12:00Z"));
        TickReport later = dispatchLoop.runTick();

        assertEquals(0, later.delivered());
        assertEquals(0, dispatchLoop.getUnconfirmedCount());
        assertTrue(firingRepository.findByScheduleIdAndFiredDate(schedule.getId(), DAY).orElseThrow().isDelivered());
        verify(delivery, times(1)).deliver(any(), any(), any());
    }

    @Test
    void shouldSkipPromptForHabitCompletedEarlierThatDay() {
        clock.set(Instant.parse("2026-10-17T07:30:00Z"));
        recorder.record(habit.getId(), DAY, Outcome.COMPLETED);

        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        TickReport report = dispatchLoop.runTick();

        assertEquals(1, report.alreadyCompleted());
        verify(delivery, never()).deliver(any(), any(), any());
        assertTrue(ledger.hasFired(schedule.getId(), DAY));
        assertTrue(scheduleClock.dueSchedules(clock.instant()).isEmpty());
    }

    @Test
    void shouldRetryFailedDeliveryOnNextTick() {
        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        when(delivery.deliver(any(), any(), any())).thenReturn(false).thenReturn(true);

        assertEquals(1, dispatchLoop.runTick().failed());
        assertFalse(ledger.hasFired(schedule.getId(), DAY));

        clock.set(Instant.parse("2026-10-17T09:02:00Z"));
        assertEquals(1, dispatchLoop.runTick().delivered());
        assertTrue(ledger.hasFired(schedule.getId(), DAY));
    }

    @Test
    void shouldGrantExactlyOneConcurrentClaim() throws Exception {
        int contenders = 4;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<FiringClaim>> claims = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                claims.add(pool.submit(() -> {
                    go.await();
                    return ledger.claimFiring(schedule.getId(), DAY, clock.instant());
                }));
            }
            go.countDown();
            int claimed = 0;
            for (Future<FiringClaim> claim : claims) {
                if (claim.get(10, TimeUnit.SECONDS) == FiringClaim.CLAIMED) {
                    claimed++;
                }
            }
            assertEquals(1, claimed);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldDeliverOnceWhenDispatchedConcurrently() throws Exception {
        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<Boolean> a = pool.submit(() -> {
                go.await();
                return dispatchLoop.dispatchNow(schedule.getId());
            });
            Future<Boolean> b = pool.submit(() -> {
                go.await();
                return dispatchLoop.dispatchNow(schedule.getId());
            });
            go.countDown();
            a.get(10, TimeUnit.SECONDS);
            b.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        verify(delivery, times(1)).deliver(any(), any(), any());
    }

    @Test
    void shouldRedeliverAbandonedClaimAfterItExpires() {
        // claimed by a dispatcher that died before confirming
        ledger.claimFiring(schedule.getId(), DAY, Instant.parse("2026-10-17T09:00:30Z"));

        clock.set(Instant.parse("2026-10-17T09:05:00Z"));
        assertTrue(scheduleClock.dueSchedules(clock.instant()).isEmpty());

        clock.set(Instant.parse("2026-10-17T09:11:00Z"));
        assertEquals(1, dispatchLoop.runTick().delivered());
        verify(delivery, times(1)).deliver(any(), any(), eq(DAY));
    }

    @Test
    void shouldKeepLatestAnswerPerDay() {
        clock.set(Instant.parse("2026-10-17T20:00:00Z"));
        recorder.record(habit.getId(), DAY, Outcome.COMPLETED);
        recorder.recordAnswer(habit.getId(), DAY, "skipped");

        List<CompletionRecord> records = ledger.completionsOf(habit.getId());
        assertEquals(1, records.size());
        assertEquals(Outcome.SKIPPED, records.get(0).getOutcome());
        assertEquals(Outcome.SKIPPED, ledger.completionOn(habit.getId(), DAY).orElseThrow().getOutcome());
    }

    @Test
    void shouldRejectFutureCompletion() {
        assertThrows(InvalidDateException.class,
            () -> recorder.record(habit.getId(), DAY.plusDays(1), Outcome.COMPLETED));
        assertTrue(ledger.completionsOf(habit.getId()).isEmpty());
    }

    @Test
    void shouldComputeStreaksFromStoredRecords() {
        clock.set(Instant.parse("2026-10-20T12:00:00Z"));
        recorder.record(habit.getId(), LocalDate.of(2026, 10, 17), Outcome.COMPLETED);
        recorder.record(habit.getId(), LocalDate.of(2026, 10, 18), Outcome.COMPLETED);
        recorder.record(habit.getId(), LocalDate.of(2026, 10, 19), Outcome.COMPLETED);

        assertEquals(3, aggregator.currentStreak(habit.getId(), LocalDate.of(2026, 10, 19)));
        assertEquals(0, aggregator.currentStreak(habit.getId(), LocalDate.of(2026, 10, 20)));

        HabitReport report = aggregator.report(habit.getId());
        assertEquals(3, report.bestStreak());
        assertEquals(4, report.lifetime().totalDays());
        assertEquals(3, ledger.completionsBetween(habit.getId(), DAY, DAY.plusDays(5)).size());
    }

    @Test
    void shouldRejectDuplicateActiveSchedule() {
        assertThrows(DuplicateScheduleException.class,
            () -> ledger.addSchedule(habit.getId(), LocalTime.of(9, 0, 30), null));

        ledger.deactivateSchedule(schedule.getId());
        Schedule replacement = ledger.addSchedule(habit.getId(), LocalTime.of(9, 0), "Europe/Paris");

        assertEquals("Europe/Paris", replacement.getTimeZone());
        assertEquals(2, ledger.schedulesOf(habit.getId()).size());
        assertEquals(1, ledger.schedulesOfOwner(1001L).size());
    }

    @Test
    void shouldIgnoreInactiveSchedules() {
        ledger.deactivateSchedule(schedule.getId());
        clock.set(Instant.parse("2026-10-17T09:01:00Z"));

        assertTrue(scheduleClock.dueSchedules(clock.instant()).isEmpty());
    }

    @Test
    void shouldDeleteHabitWithItsLedger() {
        clock.set(Instant.parse("2026-10-17T09:01:00Z"));
        dispatchLoop.runTick();
        recorder.record(habit.getId(), DAY, Outcome.COMPLETED);

        ledger.deleteHabit(habit.getId());

        assertTrue(ledger.findHabit(habit.getId()).isEmpty());
        assertTrue(scheduleRepository.findByHabitIdOrderByTimeOfDayAsc(habit.getId()).isEmpty());
        assertTrue(completionRepository.findByHabitIdOrderByRecordDateAsc(habit.getId()).isEmpty());
        assertFalse(firingRepository.existsByScheduleIdAndFiredDate(schedule.getId(), DAY));
        assertThrows(NotFoundException.class, () -> ledger.deleteHabit(habit.getId()));
    }

    @Test
    void shouldEditHabitDetails() {
        ledger.renameHabit(habit.getId(), "  Morning stretch ");
        ledger.describeHabit(habit.getId(), "ten minutes");

        Habit stored = ledger.requireHabit(habit.getId());
        assertEquals("Morning stretch", stored.getName());
        assertEquals("ten minutes", stored.getDescription());
        assertEquals(List.of(stored.getId()),
            ledger.habitsOf(1001L).stream().map(Habit::getId).toList());
    }
}
