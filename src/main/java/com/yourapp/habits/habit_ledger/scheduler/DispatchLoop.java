package com.yourapp.habits.habit_ledger.scheduler;

import com.yourapp.habits.habit_ledger.config.DispatchProperties;
import com.yourapp.habits.habit_ledger.dto.DueSchedule;
import com.yourapp.habits.habit_ledger.dto.TickReport;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.FiringClaim;
import com.yourapp.habits.habit_ledger.model.Schedule;
import com.yourapp.habits.habit_ledger.service.LedgerService;
import com.yourapp.habits.habit_ledger.service.PromptDelivery;
import com.yourapp.habits.habit_ledger.service.ScheduleClock;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that turns due schedules into delivered prompts.
 *
 * <p>
 * Each tick asks {@link ScheduleClock} for due schedules and, for every one of them:
 * <ul>
 * <li>claims the (schedule, date) firing record with a conditional insert; a lost claim
 * means another dispatcher already handled it and nothing is sent</li>
 * <li>skips the prompt, confirming the record, when the habit is already completed for that date</li>
 * <li>delivers the prompt through {@link PromptDelivery}, bounded by the delivery timeout</li>
 * <li>confirms the record on acknowledgment, or releases the claim so the schedule is
 * due again on the next tick</li>
 * </ul>
 *
 * <p>
 * A confirmation that fails after an acknowledged delivery is kept in memory and retried at
 * the start of every tick; stale claims are not expired while any such retry is pending.
 * Ticks run on a single thread with a fixed delay and never overlap. Shutdown is honoured
 * only between schedules, so a delivery that was acknowledged is always recorded.
 */
@Component
public class DispatchLoop {
    private static final Logger logger = LoggerFactory.getLogger(DispatchLoop.class);

    enum Result {
        DELIVERED,
        FAILED,
        ALREADY_HANDLED,
        ALREADY_COMPLETED
    }

    record FiringKey(Long scheduleId, LocalDate date) {
    }

    private final ScheduleClock scheduleClock;
    private final LedgerService ledger;
    private final PromptDelivery delivery;
    private final DispatchProperties properties;
    private final Clock clock;
    private final ExecutorService deliveryExecutor;

    private final Map<FiringKey, Instant> unconfirmed = new ConcurrentHashMap<>();
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private volatile boolean stopping;
    private volatile Instant lastTickAt;
    private volatile TickReport lastReport = TickReport.empty();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @Autowired
    public DispatchLoop(ScheduleClock scheduleClock,
                        LedgerService ledger,
                        PromptDelivery delivery,
                        DispatchProperties properties,
                        Clock clock) {
        this.scheduleClock = scheduleClock;
        this.ledger = ledger;
        this.delivery = delivery;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger deliveryThreads = new AtomicInteger();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "prompt-delivery-" + deliveryThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Verifies the store and starts ticking. An unreachable store fails application startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!properties.isEnabled()) {
            logger.info("[Dispatch] Loop disabled");
            return;
        }
        if (scheduler != null) {
            return;
        }
        long habits = ledger.verifyReachable();
        stopping = false;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "habit-dispatch");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = properties.getTickInterval().toMillis();
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMillis, TimeUnit.MILLISECONDS);

        logger.info("[Dispatch] Started with tick interval {} ({} habits in ledger)",
            properties.getTickInterval(), habits);
    }

    @PreDestroy
    public synchronized void shutdown() {
        stopping = true;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(properties.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("[Dispatch] In-flight tick did not finish within {}", properties.getShutdownGrace());
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        deliveryExecutor.shutdownNow();
        logger.info("[Dispatch] Shut down");
    }

    public boolean isRunning() {
        return scheduler != null && !stopping;
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    public TickReport getLastReport() {
        return lastReport;
    }

    /**
     * Deliveries that were acknowledged but whose firing record is not confirmed yet.
     */
    public int getUnconfirmedCount() {
        return unconfirmed.size();
    }

    void tick() {
        try {
            TickReport report = runTick();
            if (report.due() > 0) {
                logger.info("[Dispatch] Tick: {} due, {} delivered, {} failed, {} already handled, {} already completed",
                    report.due(), report.delivered(), report.failed(), report.alreadyHandled(),
                    report.alreadyCompleted());
            }
        } catch (RuntimeException e) {
            logger.error("[Dispatch] Tick failed", e);
        }
    }

    /**
     * Runs one tick at the current instant unless another tick is in progress.
     */
    public TickReport runTick() {
        if (!executing.compareAndSet(false, true)) {
            logger.debug("[Dispatch] Tick skipped: previous execution still in progress");
            return TickReport.empty();
        }
        try {
            TickReport report = dispatchDue(clock.instant());
            lastTickAt = clock.instant();
            lastReport = report;
            return report;
        } finally {
            executing.set(false);
        }
    }

    TickReport dispatchDue(Instant now) {
        retryConfirmations();
        if (unconfirmed.isEmpty()) {
            ledger.expireStaleClaims(now.minus(properties.getClaimTtl()));
        } else {
            logger.warn("[Dispatch] {} delivered prompt(s) still unconfirmed; not expiring claims", unconfirmed.size());
        }

        List<DueSchedule> due = scheduleClock.dueSchedules(now);
        int delivered = 0;
        int failed = 0;
        int alreadyHandled = 0;
        int alreadyCompleted = 0;
        for (DueSchedule item : due) {
            if (stopping) {
                logger.info("[Dispatch] Stopping; remaining schedules wait for the next run");
                break;
            }
            Result result = dispatch(item);
            if (result == Result.DELIVERED) {
                delivered++;
            } else if (result == Result.ALREADY_HANDLED) {
                alreadyHandled++;
            } else if (result == Result.ALREADY_COMPLETED) {
                alreadyCompleted++;
            } else {
                failed++;
            }
        }
        return new TickReport(due.size(), delivered, failed, alreadyHandled, alreadyCompleted);
    }

    /**
     * Sends today's prompt for one schedule now, if it is due and has not fired yet.
     *
     * @return true if a prompt was delivered by this call
     */
    public boolean dispatchNow(Long scheduleId) {
        if (stopping) {
            logger.debug("[Dispatch] Stopping; schedule {} not dispatched", scheduleId);
            return false;
        }
        Schedule schedule = ledger.requireSchedule(scheduleId);
        Optional<DueSchedule> due = scheduleClock.dueToday(schedule, clock.instant());
        if (due.isEmpty()) {
            logger.debug("[Dispatch] Schedule {} is not due", scheduleId);
            return false;
        }
        return dispatch(due.get()) == Result.DELIVERED;
    }

    Result dispatch(DueSchedule due) {
        Long scheduleId = due.scheduleId();
        LocalDate date = due.dueDate();
        if (unconfirmed.containsKey(new FiringKey(scheduleId, date))) {
            logger.debug("[Dispatch] Schedule {} for {} delivered, confirmation pending", scheduleId, date);
            return Result.ALREADY_HANDLED;
        }

        FiringClaim claim;
        try {
            claim = ledger.claimFiring(scheduleId, date, clock.instant());
        } catch (RuntimeException e) {
            logger.error("[Dispatch] Could not claim schedule {} for {}: {}", scheduleId, date, e.getMessage());
            return Result.FAILED;
        }
        if (claim == FiringClaim.ALREADY_HANDLED) {
            logger.debug("[Dispatch] Schedule {} for {} already handled", scheduleId, date);
            return Result.ALREADY_HANDLED;
        }

        boolean completed;
        try {
            completed = ledger.completionOn(due.habitId(), date)
                .map(CompletionRecord::isCompleted)
                .orElse(false);
        } catch (RuntimeException e) {
            logger.error("[Dispatch] Could not read completion of habit {} for {}: {}", due.habitId(), date, e.getMessage());
            release(scheduleId, date);
            return Result.FAILED;
        }
        if (completed) {
            // nothing to ask; the record still marks the day as handled
            confirm(scheduleId, date);
            logger.debug("[Dispatch] Habit {} already completed on {}, prompt skipped", due.habitId(), date);
            return Result.ALREADY_COMPLETED;
        }

        if (!deliverWithTimeout(due)) {
            release(scheduleId, date);
            return Result.FAILED;
        }

        confirm(scheduleId, date);
        logger.info("[Dispatch] Sent prompt for habit {} '{}' (schedule {}, {})",
            due.habitId(), due.habit().getName(), scheduleId, date);
        return Result.DELIVERED;
    }

    private boolean deliverWithTimeout(DueSchedule due) {
        long timeoutMillis = properties.getDeliveryTimeout().toMillis();
        Future<Boolean> attempt;
        try {
            attempt = deliveryExecutor.submit(() -> delivery.deliver(due.habit(), due.schedule(), due.dueDate()));
        } catch (RejectedExecutionException e) {
            logger.warn("[Dispatch] Delivery for schedule {} rejected: loop is shut down", due.scheduleId());
            return false;
        }
        try {
            boolean acknowledged = Boolean.TRUE.equals(attempt.get(timeoutMillis, TimeUnit.MILLISECONDS));
            if (!acknowledged) {
                logger.warn("[Dispatch] Delivery not acknowledged for schedule {}", due.scheduleId());
            }
            return acknowledged;
        } catch (TimeoutException e) {
            attempt.cancel(true);
            logger.warn("[Dispatch] Delivery for schedule {} timed out after {} ms", due.scheduleId(), timeoutMillis);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("[Dispatch] Delivery for schedule {} failed: {}", due.scheduleId(), cause.getMessage());
            return false;
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void confirm(Long scheduleId, LocalDate date) {
        Instant at = clock.instant();
        try {
            ledger.confirmFiring(scheduleId, date, at);
        } catch (RuntimeException e) {
            unconfirmed.put(new FiringKey(scheduleId, date), at);
            logger.error("[Dispatch] Could not confirm schedule {} for {}; retrying next tick", scheduleId, date, e);
        }
    }

    private void retryConfirmations() {
        for (Map.Entry<FiringKey, Instant> entry : unconfirmed.entrySet()) {
            FiringKey key = entry.getKey();
            try {
                ledger.confirmFiring(key.scheduleId(), key.date(), entry.getValue());
                unconfirmed.remove(key);
                logger.info("[Dispatch] Confirmed schedule {} for {} on retry", key.scheduleId(), key.date());
            } catch (RuntimeException e) {
                logger.warn("[Dispatch] Confirmation of schedule {} for {} failed again: {}",
                    key.scheduleId(), key.date(), e.getMessage());
            }
        }
    }

    private void release(Long scheduleId, LocalDate date) {
        try {
            ledger.releaseFiring(scheduleId, date);
        } catch (RuntimeException e) {
            // stays claimed until the claim expires
            logger.error("[Dispatch] Could not release claim of schedule {} for {}", scheduleId, date, e);
        }
    }
}
