package com.csg.finops.budgetcap.application.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for budget notification handling and the Google Cloud clients.
 */
@ConfigMapping(prefix = "budget-cap")
public interface BudgetCapConfig {

    /**
     * Prefix of the per-project Firestore collection, joined to the project id with a dash.
     * Bound to the COLLECTION_NAME_PREFIX environment variable in application.properties.
     * @return collection name prefix
     */
    @WithDefault("budget-notifications")
    String collectionNamePrefix();

    /**
     * Name of the single ledger document in each project collection.
     * The "0-" prefix makes it sort first in the Firestore console.
     * @return ledger document name
     */
    @WithDefault("0-costs-per-interval-starts")
    String ledgerDocumentName();

    /**
     * Upper bound on each Firestore or Cloud Billing call.
     * @return client call timeout
     */
    @WithDefault("10s")
    Duration clientTimeout();

    FirestoreSettings firestore();

    interface FirestoreSettings {

        /**
         * Project hosting the Firestore database. Application default credentials decide when absent.
         */
        Optional<String> projectId();

        @WithDefault("(default)")
        String databaseId();
    }
}
