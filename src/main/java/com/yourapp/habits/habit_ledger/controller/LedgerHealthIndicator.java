package com.yourapp.habits.habit_ledger.controller;

import com.yourapp.habits.habit_ledger.dto.TickReport;
import com.yourapp.habits.habit_ledger.exception.LedgerUnavailableException;
import com.yourapp.habits.habit_ledger.scheduler.DispatchLoop;
import com.yourapp.habits.habit_ledger.service.LedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports store reachability and the dispatch loop's last tick under /actuator/health.
 */
@Component("ledger")
@RequiredArgsConstructor
public class LedgerHealthIndicator implements HealthIndicator {

    private final LedgerService ledger;
    private final DispatchLoop dispatchLoop;

    @Override
    public Health health() {
        try {
            long habits = ledger.verifyReachable();
            TickReport last = dispatchLoop.getLastReport();
            Health.Builder builder = Health.up()
                    .withDetail("habits", habits)
                    .withDetail("dispatchRunning", dispatchLoop.isRunning())
                    .withDetail("lastTickDelivered", last.delivered())
                    .withDetail("lastTickFailed", last.failed())
                    .withDetail("unconfirmedDeliveries", dispatchLoop.getUnconfirmedCount());
            if (dispatchLoop.getLastTickAt() != null) {
                builder.withDetail("lastTickAt", dispatchLoop.getLastTickAt().toString());
            }
            return builder.build();
        } catch (LedgerUnavailableException e) {
            return Health.down(e).build();
        }
    }
}
