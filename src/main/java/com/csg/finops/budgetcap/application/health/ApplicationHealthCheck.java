package com.csg.finops.budgetcap.application.health;

import com.csg.finops.budgetcap.domain.service.MonitoringService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

/**
 * Overall application health check.
 * Reports handling counters since startup alongside the liveness status.
 */
@Liveness
@ApplicationScoped
public class ApplicationHealthCheck implements HealthCheck {

    private final MonitoringService monitoringService;

    @Inject
    public ApplicationHealthCheck(MonitoringService monitoringService) {
        this.monitoringService = monitoringService;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("Budget Cap Service");

        try {
            builder.withData("notifications_received", (long) monitoringService.getNotificationsReceivedCount());
            builder.withData("notifications_handled", (long) monitoringService.getNotificationsHandledCount());
            builder.withData("billing_disabled", (long) monitoringService.getBillingDisabledCount());
            builder.withData("failures", (long) monitoringService.getFailureCount());
            builder.up();
        } catch (Exception e) {
            builder.down().withData("error", String.valueOf(e.getMessage()));
        }

        return builder.build();
    }
}
