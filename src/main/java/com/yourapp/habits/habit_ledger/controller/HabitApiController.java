package com.yourapp.habits.habit_ledger.controller;

import com.yourapp.habits.habit_ledger.dto.CompletionDto;
import com.yourapp.habits.habit_ledger.dto.CompletionRequest;
import com.yourapp.habits.habit_ledger.dto.HabitDto;
import com.yourapp.habits.habit_ledger.dto.HabitReport;
import com.yourapp.habits.habit_ledger.dto.HabitRequest;
import com.yourapp.habits.habit_ledger.dto.LifetimeStats;
import com.yourapp.habits.habit_ledger.dto.MonthlyStats;
import com.yourapp.habits.habit_ledger.dto.ScheduleDto;
import com.yourapp.habits.habit_ledger.dto.ScheduleRequest;
import com.yourapp.habits.habit_ledger.model.CompletionRecord;
import com.yourapp.habits.habit_ledger.model.Habit;
import com.yourapp.habits.habit_ledger.model.Schedule;
import com.yourapp.habits.habit_ledger.service.CompletionRecorder;
import com.yourapp.habits.habit_ledger.service.LedgerService;
import com.yourapp.habits.habit_ledger.service.StreakAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ledger operations for the command-handling layer.
 */
@RestController
@RequestMapping("/api/habits")
@RequiredArgsConstructor
public class HabitApiController {

    private final LedgerService ledger;
    private final CompletionRecorder recorder;
    private final StreakAggregator aggregator;

    @PostMapping
    public ResponseEntity<HabitDto> create(@RequestBody HabitRequest request) {
        Habit habit = ledger.createHabit(request.ownerId(), request.name(), request.description(), request.timeZone());
        return ResponseEntity.status(HttpStatus.CREATED).body(HabitDto.from(habit));
    }

    @GetMapping
    public List<HabitDto> list(@RequestParam Long ownerId) {
        return ledger.habitsOf(ownerId).stream()
                .map(HabitDto::from)
                .collect(Collectors.toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        ledger.deleteHabit(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/schedules")
    public ResponseEntity<ScheduleDto> addSchedule(@PathVariable Long id, @RequestBody ScheduleRequest request) {
        Schedule schedule = ledger.addSchedule(id, request.timeOfDay(), request.timeZone());
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleDto.from(schedule, id));
    }

    @GetMapping("/{id}/schedules")
    public List<ScheduleDto> schedules(@PathVariable Long id) {
        return ledger.schedulesOf(id).stream()
                .map(s -> ScheduleDto.from(s, id))
                .collect(Collectors.toList());
    }

    @PutMapping("/{id}/completions/{date}")
    public CompletionDto record(@PathVariable Long id,
                                @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                @RequestBody CompletionRequest request) {
        CompletionRecord record = recorder.recordAnswer(id, date, request.outcome());
        return CompletionDto.from(record);
    }

    @GetMapping("/{id}/streak")
    public Map<String, Object> streak(@PathVariable Long id,
                                      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return Map.of("habitId", id, "asOf", asOf, "currentStreak", aggregator.currentStreak(id, asOf));
    }

    @GetMapping("/{id}/stats/monthly")
    public MonthlyStats monthly(@PathVariable Long id, @RequestParam String month) {
        return aggregator.monthlyStats(id, YearMonth.parse(month));
    }

    @GetMapping("/{id}/stats/lifetime")
    public LifetimeStats lifetime(@PathVariable Long id) {
        return aggregator.lifetimeStats(id);
    }

    @GetMapping("/{id}/report")
    public HabitReport report(@PathVariable Long id) {
        return aggregator.report(id);
    }
}
