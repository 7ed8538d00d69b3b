package com.csg.finops.budgetcap.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.concurrent.TimeUnit;

/**
 * Centralized monitoring service for budget notification handling.
 * Provides metrics for:
 * - Notifications received and handled
 * - Projects whose billing was disabled
 * - Failures by response code
 * - Handling time
 */
@ApplicationScoped
public class MonitoringService {

    private static final String FAILURES_METRIC = "budget.notifications.failures";

    private final MeterRegistry meterRegistry;

    private final Counter notificationsReceived;
    private final Counter notificationsHandled;
    private final Counter billingDisabled;
    private final Timer handlingTimer;

    @Inject
    public MonitoringService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        notificationsReceived = Counter.builder("budget.notifications.received")
                .description("Budget notifications received")
                .register(meterRegistry);

        notificationsHandled = Counter.builder("budget.notifications.handled")
                .description("Budget notifications persisted and evaluated against their budget")
                .register(meterRegistry);

        billingDisabled = Counter.builder("budget.billing.disabled")
                .description("Projects whose billing was disabled after reaching their budget")
                .register(meterRegistry);

        handlingTimer = Timer.builder("budget.notifications.processing.time")
                .description("Time to handle a budget notification end to end")
                .register(meterRegistry);
    }

    public void recordNotificationReceived() {
        notificationsReceived.increment();
    }

    public void recordNotificationHandled(long durationMs) {
        notificationsHandled.increment();
        handlingTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordBillingDisabled() {
        billingDisabled.increment();
    }

    public void recordFailure(String responseCode) {
        Counter.builder(FAILURES_METRIC)
                .description("Budget notifications that failed, by response code")
                .tag("code", responseCode == null ? "unknown" : responseCode)
                .register(meterRegistry)
                .increment();
    }

    public double getNotificationsReceivedCount() {
        return notificationsReceived.count();
    }

    public double getNotificationsHandledCount() {
        return notificationsHandled.count();
    }

    public double getBillingDisabledCount() {
        return billingDisabled.count();
    }

    public double getFailureCount() {
        return meterRegistry.find(FAILURES_METRIC).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
