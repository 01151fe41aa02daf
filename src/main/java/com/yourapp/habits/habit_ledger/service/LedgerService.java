package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.exception.DuplicateScheduleException;
import com.yourapp.habits.habit_ledger.exception.LedgerUnavailableException;
import com.yourapp.habits.habit_ledger.exception.NotFoundException;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.FiringClaim;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Outcome;
import com.yourapp.habits.habit_ledger.model.Schedule;
import com.yourapp.habits.habit_ledger.repository.CompletionRecordRepository;
import com.yourapp.habits.habit_ledger.repository.FiringRecordRepository;
import com.yourapp.habits.habit_ledger.repository.HabitRepository;
import com.yourapp.habits.habit_ledger.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of habits, schedules, firing records and completion records.
 * Uniqueness of (schedule, date) and (habit, date) is enforced by the database.
 */
@Service
@Transactional(readOnly = true)
public class LedgerService {
    private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

    private final HabitRepository habitRepo;
    private final ScheduleRepository scheduleRepo;
    private final FiringRecordRepository firingRepo;
    private final CompletionRecordRepository completionRepo;
    private final Clock clock;
    private final String defaultTimeZone;

    @Autowired
    public LedgerService(HabitRepository habitRepo,
                         ScheduleRepository scheduleRepo,
                         FiringRecordRepository firingRepo,
                         CompletionRecordRepository completionRepo,
                         Clock clock,
                         @Value("${habits.default-time-zone:UTC}") String defaultTimeZone) {
        this.habitRepo = habitRepo;
        this.scheduleRepo = scheduleRepo;
        this.firingRepo = firingRepo;
        this.completionRepo = completionRepo;
        this.clock = clock;
        this.defaultTimeZone = defaultTimeZone;
    }

    // ---- habits ----

    @Transactional
    public Habit createHabit(Long ownerId, String name, String description, String timeZone) {
        if (ownerId == null) {
            throw new IllegalArgumentException("Owner id must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Habit name must not be empty");
        }
        Habit habit = new Habit(ownerId, name.trim(), description, resolveZone(timeZone));
        habit.setCreatedAt(clock.instant());
        Habit saved = habitRepo.save(habit);
        logger.info("Created habit {} '{}' for owner {}", saved.getId(), saved.getName(), ownerId);
        return saved;
    }

    @Transactional
    public Habit renameHabit(Long habitId, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Habit name must not be empty");
        }
        Habit habit = requireHabit(habitId);
        habit.setName(name.trim());
        return habitRepo.save(habit);
    }

    @Transactional
    public Habit describeHabit(Long habitId, String description) {
        Habit habit = requireHabit(habitId);
        habit.setDescription(description);
        return habitRepo.save(habit);
    }

    public Optional<Habit> findHabit(Long habitId) {
        return habitRepo.findById(habitId);
    }

    public Habit requireHabit(Long habitId) {
        return habitRepo.findById(habitId)
            .orElseThrow(() -> NotFoundException.habit(habitId));
    }

    public List<Habit> habitsOf(Long ownerId) {
        return habitRepo.findByOwnerIdOrderByNameAsc(ownerId);
    }

    /**
     * Deletes a habit together with its schedules, firing records and completion records.
     */
    @Transactional
    public void deleteHabit(Long habitId) {
        if (!habitRepo.existsById(habitId)) {
            throw NotFoundException.habit(habitId);
        }
        firingRepo.deleteByHabitId(habitId);
        completionRepo.deleteByHabitId(habitId);
        scheduleRepo.deleteByHabitId(habitId);
        habitRepo.deleteById(habitId);
        logger.info("Deleted habit {} and its ledger", habitId);
    }

    // ---- schedules ----

    @Transactional
    public Schedule addSchedule(Long habitId, LocalTime timeOfDay, String timeZone) {
        if (timeOfDay == null) {
            throw new IllegalArgumentException("Time of day must not be null");
        }
        Habit habit = requireHabit(habitId);
        LocalTime minute = timeOfDay.truncatedTo(ChronoUnit.MINUTES);
        if (scheduleRepo.existsByHabitIdAndTimeOfDayAndActiveTrue(habitId, minute)) {
            throw new DuplicateScheduleException(habitId, minute);
        }
        String zone = timeZone != null ? resolveZone(timeZone) : habit.getTimeZone();
        Schedule schedule = new Schedule(habit, minute, zone);
        schedule.setCreatedAt(clock.instant());
        Schedule saved = scheduleRepo.save(schedule);
        logger.info("Scheduled habit {} daily at {} {}", habitId, minute, zone);
        return saved;
    }

    @Transactional
    public Schedule deactivateSchedule(Long scheduleId) {
        Schedule schedule = requireSchedule(scheduleId);
        schedule.setActive(false);
        return scheduleRepo.save(schedule);
    }

    @Transactional
    public void deleteSchedule(Long scheduleId) {
        Schedule schedule = requireSchedule(scheduleId);
        firingRepo.deleteByScheduleId(scheduleId);
        scheduleRepo.delete(schedule);
    }

    public Schedule requireSchedule(Long scheduleId) {
        return scheduleRepo.findByIdWithHabit(scheduleId)
            .orElseThrow(() -> NotFoundException.schedule(scheduleId));
    }

    public List<Schedule> schedulesOf(Long habitId) {
        requireHabit(habitId);
        return scheduleRepo.findByHabitIdOrderByTimeOfDayAsc(habitId);
    }

    public List<Schedule> schedulesOfOwner(Long ownerId) {
        return scheduleRepo.findActiveByOwner(ownerId);
    }

    /**
     * All active schedules with their habits loaded, ordered by habit id then time of day.
     */
    public List<Schedule> activeSchedules() {
        return scheduleRepo.findActiveWithHabit();
    }

    // ---- firing records ----

    /**
     * Conditionally inserts the firing record for (schedule, date). Runs outside any
     * transaction so a lost race is reported instead of thrown.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public FiringClaim claimFiring(Long scheduleId, LocalDate date, Instant at) {
        boolean inserted = firingRepo.insertIfAbsent(scheduleId, date, at);
        return inserted ? FiringClaim.CLAIMED : FiringClaim.ALREADY_HANDLED;
    }

    @Transactional
    public void confirmFiring(Long scheduleId, LocalDate date, Instant deliveredAt) {
        int updated = firingRepo.markDelivered(scheduleId, date, deliveredAt);
        if (updated == 0) {
            logger.warn("No pending firing record to confirm for schedule {} on {}", scheduleId, date);
        }
    }

    @Transactional
    public void releaseFiring(Long scheduleId, LocalDate date) {
        firingRepo.deleteUndelivered(scheduleId, date);
    }

    public boolean hasFired(Long scheduleId, LocalDate date) {
        return firingRepo.existsByScheduleIdAndFiredDate(scheduleId, date);
    }

    public List<LocalDate> firedDates(Long scheduleId, LocalDate from, LocalDate to) {
        return firingRepo.findFiredDates(scheduleId, from, to);
    }

    /**
     * Drops claims that were never confirmed, e.g. because the process died mid-delivery.
     *
     * @return number of claims removed
     */
    @Transactional
    public int expireStaleClaims(Instant claimedBefore) {
        int removed = firingRepo.deleteUndeliveredClaimedBefore(claimedBefore);
        if (removed > 0) {
            logger.warn("Expired {} unconfirmed firing claim(s) older than {}", removed, claimedBefore);
        }
        return removed;
    }

    // ---- completion records ----

    /**
     * Creates or overwrites the completion record of a habit for one date.
     */
    @Transactional
    public CompletionRecord upsertCompletion(Habit habit, LocalDate date, Outcome outcome, Instant at) {
        CompletionRecord record = completionRepo.findByHabitIdAndRecordDate(habit.getId(), date)
            .orElseGet(() -> new CompletionRecord(habit, date, outcome, at));
        record.setOutcome(outcome);
        record.setRecordedAt(at);
        return completionRepo.saveAndFlush(record);
    }

    public List<CompletionRecord> completionsOf(Long habitId) {
        return completionRepo.findByHabitIdOrderByRecordDateAsc(habitId);
    }

    public List<CompletionRecord> completionsBetween(Long habitId, LocalDate from, LocalDate to) {
        return completionRepo.findByHabitIdAndRecordDateBetweenOrderByRecordDateAsc(habitId, from, to);
    }

    public Optional<CompletionRecord> completionOn(Long habitId, LocalDate date) {
        return completionRepo.findByHabitIdAndRecordDate(habitId, date);
    }

    // ---- health ----

    /**
     * Round-trips a query to the store.
     *
     * @throws LedgerUnavailableException if the store does not answer
     */
    public long verifyReachable() {
        try {
            return habitRepo.count();
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Ledger store is unreachable: " + e.getMessage(), e);
        }
    }

    private String resolveZone(String timeZone) {
        String zone = timeZone != null && !timeZone.isBlank() ? timeZone.trim() : defaultTimeZone;
        try {
            return ZoneId.of(zone).getId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + zone, e);
        }
    }
}
