package com.csg.finops.budgetcap.domain.service;

import com.csg.finops.budgetcap.application.config.BudgetCapConfig;
import com.csg.finops.budgetcap.domain.constant.AppConstant;
import com.csg.finops.budgetcap.domain.model.BudgetNotification;
import com.csg.finops.budgetcap.domain.model.CostLedger;
import com.csg.finops.budgetcap.domain.model.HandlingResult;
import com.csg.finops.budgetcap.domain.model.NotificationRecord;
import com.csg.finops.budgetcap.domain.util.StructuredLogger;
import com.csg.finops.budgetcap.exception.BaseException;
import com.csg.finops.budgetcap.exception.BillingAlreadyDisabledException;
import com.csg.finops.budgetcap.external.clients.BillingControlClient;
import com.csg.finops.budgetcap.external.repository.CostLedgerRepository;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Caps a project's costs from its budget notifications.
 * <p>
 * For each notification: billing must be enabled, the cost is recorded against its interval start
 * in the project's ledger, the ledger and an audit record are committed in one batch, and billing is
 * disabled once the total over all intervals reaches the budget.
 * <p>
 * The ledger read-modify-write is not transactional: two notifications for the same project handled
 * concurrently can lose one interval update.
 */
@ApplicationScoped
public class BudgetNotificationHandler {

    private static final StructuredLogger LOG = StructuredLogger.getLogger(BudgetNotificationHandler.class);
    private static final String COMPONENT = "budget-handler";

    private final BudgetNotificationDecoder decoder;
    private final BillingControlClient billingControlClient;
    private final CostLedgerRepository costLedgerRepository;
    private final MonitoringService monitoringService;
    private final BudgetCapConfig config;
    private final Clock clock;

    @Inject
    public BudgetNotificationHandler(BudgetNotificationDecoder decoder,
                                     BillingControlClient billingControlClient,
                                     CostLedgerRepository costLedgerRepository,
                                     MonitoringService monitoringService,
                                     BudgetCapConfig config,
                                     Clock clock) {
        this.decoder = decoder;
        this.billingControlClient = billingControlClient;
        this.costLedgerRepository = costLedgerRepository;
        this.monitoringService = monitoringService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Decode and handle the base64 data of a Pub/Sub message.
     */
    public Uni<HandlingResult> handle(String base64Data) {
        return Uni.createFrom().item(() -> decoder.decode(base64Data))
                .onFailure(BaseException.class).invoke(this::recordFailure)
                .onItem().transformToUni(notification -> handle(notification));
    }

    public Uni<HandlingResult> handle(BudgetNotification notification) {
        long startTime = System.currentTimeMillis();
        String projectId = notification.projectId();
        String collectionName = collectionNameFor(projectId);

        monitoringService.recordNotificationReceived();
        StructuredLogger.setProjectId(projectId);
        LOG.info("Handling budget notification", StructuredLogger.Fields.create()
                .addProjectId(projectId)
                .add("budgetAmount", notification.budgetAmount())
                .add("costAmount", notification.costAmount())
                .add("costIntervalStart", notification.costIntervalStart())
                .add("currencyCode", notification.currencyCode())
                .add("alertThresholdExceeded", notification.alertThresholdExceeded())
                .add("collection", collectionName)
                .addComponent(COMPONENT)
                .build());

        return billingControlClient.isBillingEnabled(projectId)
                .onItem().transformToUni(enabled -> {
                    if (!Boolean.TRUE.equals(enabled)) {
                        return Uni.createFrom().<CostLedger>failure(new BillingAlreadyDisabledException(projectId));
                    }
                    return recordCost(collectionName, notification);
                })
                .onItem().transformToUni(ledger -> enforceBudget(projectId, collectionName, ledger, notification))
                .onItem().invoke(result -> {
                    long duration = System.currentTimeMillis() - startTime;
                    monitoringService.recordNotificationHandled(duration);
                    LOG.info("Completed budget notification handling", StructuredLogger.Fields.create()
                            .addProjectId(projectId)
                            .add("action", result.action())
                            .addDuration(duration)
                            .addStatus("success")
                            .addComponent(COMPONENT)
                            .build());
                })
                .onFailure(BaseException.class).invoke(this::recordFailure);
    }

    /**
     * Collection holding the ledger and notification records of a project.
     */
    public String collectionNameFor(String projectId) {
        return config.collectionNamePrefix() + AppConstant.COLLECTION_NAME_SEPARATOR + projectId;
    }

    private Uni<CostLedger> recordCost(String collectionName, BudgetNotification notification) {
        NotificationRecord record = NotificationRecord.of(notification, LocalDateTime.now(clock));
        return costLedgerRepository.getLedger(collectionName)
                .onItem().transform(ledger ->
                        ledger.withCost(notification.costIntervalStart(), notification.costAmount()))
                .onItem().invoke(ledger -> LOG.info("Costs per interval start updated", StructuredLogger.Fields.create()
                        .addProjectId(notification.projectId())
                        .add("costsPerIntervalStart", ledger.asMap())
                        .addComponent(COMPONENT)
                        .build()))
                .call(ledger -> costLedgerRepository.persist(collectionName, ledger, record));
    }

    private Uni<HandlingResult> enforceBudget(String projectId,
                                              String collectionName,
                                              CostLedger ledger,
                                              BudgetNotification notification) {
        double total = ledger.total();
        double budget = notification.budgetAmount();

        if (total < budget) {
            LOG.info("No action taken on total cost amount", StructuredLogger.Fields.create()
                    .addProjectId(projectId)
                    .add("total", total)
                    .add("budgetAmount", budget)
                    .addComponent(COMPONENT)
                    .build());
            return Uni.createFrom().item(HandlingResult.noAction(projectId, collectionName, ledger, budget));
        }

        LOG.warn("Total cost amount reached budget, disabling billing", StructuredLogger.Fields.create()
                .addProjectId(projectId)
                .add("total", total)
                .add("budgetAmount", budget)
                .addComponent(COMPONENT)
                .build());
        return billingControlClient.disableBilling(projectId)
                .onItem().invoke(monitoringService::recordBillingDisabled)
                .replaceWith(HandlingResult.billingDisabled(projectId, collectionName, ledger, budget));
    }

    private void recordFailure(Throwable failure) {
        monitoringService.recordFailure(((BaseException) failure).getResponseCode());
    }
}
