package com.yourapp.habits.habit_ledger.service;

import com.yourapp.habits.habit_ledger.config.DispatchProperties;
import com.yourapp.habits.habit_ledger.config.DispatchProperties.CatchUpPolicy;
import com.yourapp.habits.habit_ledger.dto.DueSchedule;
import com.yourapp.habits.habit_ledger.model.Schedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which schedules are due at a given instant. Holds no state of its own: the
 * firing records in the ledger are the only record of what was already sent.
 */
@Service
@RequiredArgsConstructor
public class ScheduleClock {

    static final Comparator<DueSchedule> DISPATCH_ORDER = Comparator
        .comparing(DueSchedule::habitId)
        .thenComparing(d -> d.schedule().getTimeOfDay())
        .thenComparing(DueSchedule::scheduleId)
        .thenComparing(DueSchedule::dueDate);

    private final LedgerService ledger;
    private final DispatchProperties properties;

    /**
     * Active schedules whose time of day has passed on their local date at {@code now}
     * and that have no firing record for that date, in dispatch order.
     */
    public List<DueSchedule> dueSchedules(Instant now) {
        List<DueSchedule> due = new ArrayList<>();
        for (Schedule schedule : ledger.activeSchedules()) {
            due.addAll(dueDatesFor(schedule, now));
        }
        due.sort(DISPATCH_ORDER);
        return due;
    }

    /**
     * Today's due entry for one schedule, if it is active, past its time and not yet fired.
     */
    public Optional<DueSchedule> dueToday(Schedule schedule, Instant now) {
        if (!schedule.isActive()) {
            return Optional.empty();
        }
        ZonedDateTime local = now.atZone(schedule.getZoneId());
        LocalDate today = local.toLocalDate();
        if (schedule.getTimeOfDay().isAfter(local.toLocalTime())) {
            return Optional.empty();
        }
        if (ledger.hasFired(schedule.getId(), today)) {
            return Optional.empty();
        }
        return Optional.of(new DueSchedule(schedule, schedule.getHabit(), today));
    }

    private List<DueSchedule> dueDatesFor(Schedule schedule, Instant now) {
        List<DueSchedule> due = new ArrayList<>();
        if (properties.getCatchUpPolicy() == CatchUpPolicy.BACKFILL && properties.getCatchUpMaxDays() > 0) {
            due.addAll(missedDays(schedule, now));
        }
        dueToday(schedule, now).ifPresent(due::add);
        return due;
    }

    // Past local dates in the catch-up window that never got a firing record
    private List<DueSchedule> missedDays(Schedule schedule, Instant now) {
        LocalDate today = now.atZone(schedule.getZoneId()).toLocalDate();
        LocalDate from = today.minusDays(properties.getCatchUpMaxDays());
        if (schedule.getCreatedAt() != null) {
            LocalDate firstDay = firstFiringDay(schedule);
            if (firstDay.isAfter(from)) {
                from = firstDay;
            }
        }
        LocalDate to = today.minusDays(1);
        if (from.isAfter(to)) {
            return List.of();
        }
        Set<LocalDate> fired = new HashSet<>(ledger.firedDates(schedule.getId(), from, to));
        List<DueSchedule> missed = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            if (!fired.contains(day)) {
                missed.add(new DueSchedule(schedule, schedule.getHabit(), day));
            }
        }
        return missed;
    }

    // A schedule created after its time of day first fires the next day
    private static LocalDate firstFiringDay(Schedule schedule) {
        ZonedDateTime created = schedule.getCreatedAt().atZone(schedule.getZoneId());
        LocalDate day = created.toLocalDate();
        return created.toLocalTime().isAfter(schedule.getTimeOfDay()) ? day.plusDays(1) : day;
    }
}
