package com.yourapp.habits.habit_ledger.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "habits.dispatch")
public class DispatchProperties {

    /**
     * What to do with days missed while the process was down.
     */
    public enum CatchUpPolicy {
        SKIP_MISSED,
        BACKFILL
    }

    private boolean enabled = true;
    private Duration tickInterval = Duration.ofSeconds(60);
    private Duration deliveryTimeout = Duration.ofSeconds(10);
    private Duration claimTtl = Duration.ofMinutes(10);
    private Duration shutdownGrace = Duration.ofSeconds(30);
    private CatchUpPolicy catchUpPolicy = CatchUpPolicy.SKIP_MISSED;
    private int catchUpMaxDays = 3;

    @PostConstruct
    public void init() {
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalStateException("habits.dispatch.tick-interval must be positive");
        }
        if (claimTtl.compareTo(deliveryTimeout) <= 0) {
            throw new IllegalStateException("habits.dispatch.claim-ttl must exceed delivery-timeout");
        }
        if (catchUpMaxDays < 0) {
            throw new IllegalStateException("habits.dispatch.catch-up-max-days must not be negative");
        }
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
    public Duration getDeliveryTimeout() { return deliveryTimeout; }
    public void setDeliveryTimeout(Duration deliveryTimeout) { this.deliveryTimeout = deliveryTimeout; }
    public Duration getClaimTtl() { return claimTtl; }
    public void setClaimTtl(Duration claimTtl) { this.claimTtl = claimTtl; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    public CatchUpPolicy getCatchUpPolicy() { return catchUpPolicy; }
    public void setCatchUpPolicy(CatchUpPolicy catchUpPolicy) { this.catchUpPolicy = catchUpPolicy; }
    public int getCatchUpMaxDays() { return catchUpMaxDays; }
    public void setCatchUpMaxDays(int catchUpMaxDays) { this.catchUpMaxDays = catchUpMaxDays; }
}
