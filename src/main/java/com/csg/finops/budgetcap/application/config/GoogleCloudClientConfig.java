package com.csg.finops.budgetcap.application.config;

import com.google.cloud.billing.v1.CloudBillingClient;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Produces the Google Cloud clients used by the service.
 * Both authenticate with application default credentials and are closed on shutdown.
 */
@ApplicationScoped
public class GoogleCloudClientConfig {

    private static final Logger log = Logger.getLogger(GoogleCloudClientConfig.class);

    private final BudgetCapConfig config;

    public GoogleCloudClientConfig(BudgetCapConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public Firestore firestore() {
        FirestoreOptions.Builder options = FirestoreOptions.newBuilder()
                .setDatabaseId(config.firestore().databaseId());
        config.firestore().projectId().ifPresent(options::setProjectId);
        Firestore firestore = options.build().getService();
        log.infof("Firestore client created for project %s, database %s",
                firestore.getOptions().getProjectId(), config.firestore().databaseId());
        return firestore;
    }

    @Produces
    @Singleton
    public CloudBillingClient cloudBillingClient() {
        try {
            return CloudBillingClient.create();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create Cloud Billing client", e);
        }
    }

    void closeFirestore(@Disposes Firestore firestore) {
        try {
            firestore.close();
        } catch (Exception e) {
            log.warnf(e, "Failed to close Firestore client");
        }
    }

    void closeCloudBillingClient(@Disposes CloudBillingClient client) {
        client.close();
    }
}
