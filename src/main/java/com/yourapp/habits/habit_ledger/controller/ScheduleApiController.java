package com.yourapp.habits.habit_ledger.controller;

import com.yourapp.habits.habit_ledger.dto.DueScheduleDto;
import com.yourapp.habits.habit_ledger.scheduler.DispatchLoop;
import com.yourapp.habits.habit_ledger.service.LedgerService;
import com.yourapp.habits.habit_ledger.service.ScheduleClock;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/schedules")
@RequiredArgsConstructor
public class ScheduleApiController {

    private final ScheduleClock scheduleClock;
    private final DispatchLoop dispatchLoop;
    private final LedgerService ledger;
    private final Clock clock;

    // Schedules due at the given instant (default: now)
    @GetMapping("/due")
    public List<DueScheduleDto> due(@RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        Instant now = at != null ? at : clock.instant();
        return scheduleClock.dueSchedules(now).stream()
                .map(DueScheduleDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/{id}/dispatch")
    public Map<String, Object> dispatch(@PathVariable Long id) {
        boolean delivered = dispatchLoop.dispatchNow(id);
        return Map.of("scheduleId", id, "delivered", delivered);
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<Void> deactivate(@PathVariable Long id) {
        ledger.deactivateSchedule(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        ledger.deleteSchedule(id);
        return ResponseEntity.noContent().build();
    }
}
