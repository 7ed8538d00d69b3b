package com.csg.finops.budgetcap.external.clients;

import com.csg.finops.budgetcap.application.config.BudgetCapConfig;
import com.csg.finops.budgetcap.domain.constant.AppConstant;
import com.csg.finops.budgetcap.exception.BaseException;
import com.csg.finops.budgetcap.exception.BillingControlException;
import com.google.cloud.billing.v1.CloudBillingClient;
import com.google.cloud.billing.v1.GetProjectBillingInfoRequest;
import com.google.cloud.billing.v1.ProjectBillingInfo;
import com.google.cloud.billing.v1.UpdateProjectBillingInfoRequest;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Client for the Cloud Billing API project billing info endpoints.
 * Checks whether a project is linked to a billing account and unlinks it to cap costs.
 */
@ApplicationScoped
public class BillingControlClient {

    private static final Logger log = Logger.getLogger(BillingControlClient.class);

    private final CloudBillingClient cloudBillingClient;
    private final BudgetCapConfig config;

    @Inject
    public BillingControlClient(CloudBillingClient cloudBillingClient, BudgetCapConfig config) {
        this.cloudBillingClient = cloudBillingClient;
        this.config = config;
    }

    /**
     * Check whether billing is enabled for a project.
     * An absent billing info or an absent billingEnabled flag both count as not enabled.
     *
     * @param projectId the project to check
     * @return Uni emitting true only when billing is confirmed enabled
     */
    public Uni<Boolean> isBillingEnabled(String projectId) {
        GetProjectBillingInfoRequest request = GetProjectBillingInfoRequest.newBuilder()
                .setName(projectResourceName(projectId))
                .build();

        return Uni.createFrom().deferred(() ->
                        ApiFutureAdapter.toUni(cloudBillingClient.getProjectBillingInfoCallable().futureCall(request)))
                .ifNoItem().after(config.clientTimeout())
                .failWith(() -> new BillingControlException("Timed out reading billing info of project " + projectId))
                .onItem().transform(billingInfo -> billingInfo != null && billingInfo.getBillingEnabled())
                .onItem().invoke(enabled -> log.infof("Billing enabled for project %s: %s", projectId, enabled))
                .onFailure(failure -> !(failure instanceof BaseException))
                .transform(failure -> new BillingControlException(
                        "Failed to read billing info of project " + projectId, failure));
    }

    /**
     * Disable billing for a project by unlinking its billing account.
     * Fails with {@link BillingControlException} when the returned billing info still names an account.
     *
     * @param projectId the project to cap
     * @return Uni completing once the project is confirmed unlinked
     */
    public Uni<Void> disableBilling(String projectId) {
        UpdateProjectBillingInfoRequest request = UpdateProjectBillingInfoRequest.newBuilder()
                .setName(projectResourceName(projectId))
                .setProjectBillingInfo(ProjectBillingInfo.newBuilder()
                        .setBillingAccountName(AppConstant.UNLINKED_BILLING_ACCOUNT)
                        .build())
                .build();

        return Uni.createFrom().deferred(() ->
                        ApiFutureAdapter.toUni(cloudBillingClient.updateProjectBillingInfoCallable().futureCall(request)))
                .ifNoItem().after(config.clientTimeout())
                .failWith(() -> new BillingControlException("Timed out disabling billing of project " + projectId))
                .onItem().transform(billingInfo -> verifyUnlinked(projectId, billingInfo))
                .onFailure(failure -> !(failure instanceof BaseException))
                .transform(failure -> new BillingControlException(
                        "Failed to disable billing of project " + projectId, failure))
                .replaceWithVoid();
    }

    private ProjectBillingInfo verifyUnlinked(String projectId, ProjectBillingInfo billingInfo) {
        if (billingInfo == null || !billingInfo.getBillingAccountName().isEmpty()) {
            String accountName = billingInfo == null ? "<no billing info>" : billingInfo.getBillingAccountName();
            log.errorf("Billing account still linked to project %s after disabling: %s", projectId, accountName);
            throw new BillingControlException("Billing account " + accountName
                    + " still linked to project " + projectId + " after disabling billing");
        }
        log.infof("Billing disabled for project %s", projectId);
        return billingInfo;
    }

    static String projectResourceName(String projectId) {
        return AppConstant.PROJECT_RESOURCE_PREFIX + projectId;
    }
}
