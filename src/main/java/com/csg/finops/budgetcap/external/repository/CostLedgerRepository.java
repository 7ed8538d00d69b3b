package com.csg.finops.budgetcap.external.repository;

import com.csg.finops.budgetcap.application.config.BudgetCapConfig;
import com.csg.finops.budgetcap.domain.model.CostLedger;
import com.csg.finops.budgetcap.domain.model.NotificationRecord;
import com.csg.finops.budgetcap.exception.BaseException;
import com.csg.finops.budgetcap.exception.CostLedgerStoreException;
import com.csg.finops.budgetcap.external.clients.ApiFutureAdapter;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.WriteBatch;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Firestore repository owning one collection per capped project.
 * Each collection holds the cost ledger document and one auto-id document per received notification.
 */
@ApplicationScoped
public class CostLedgerRepository {

    private static final Logger log = Logger.getLogger(CostLedgerRepository.class);

    final Firestore firestore;
    final BudgetCapConfig config;

    @Inject
    public CostLedgerRepository(Firestore firestore, BudgetCapConfig config) {
        this.firestore = firestore;
        this.config = config;
    }

    /**
     * Fetches the cost ledger of a project collection.
     *
     * @param collectionName the project collection
     * @return Uni containing the ledger, empty when no ledger document exists yet
     */
    public Uni<CostLedger> getLedger(String collectionName) {
        if (log.isDebugEnabled()) {
            log.debugf("Fetching cost ledger from collection: %s", collectionName);
        }
        return Uni.createFrom().deferred(() -> ApiFutureAdapter.toUni(
                        firestore.collection(collectionName).document(config.ledgerDocumentName()).get()))
                .ifNoItem().after(config.clientTimeout())
                .failWith(() -> new CostLedgerStoreException("Timed out reading cost ledger of collection " + collectionName))
                .onItem().transform(snapshot -> toLedger(collectionName, snapshot))
                .onFailure(failure -> !(failure instanceof BaseException))
                .transform(failure -> new CostLedgerStoreException(
                        "Failed to read cost ledger of collection " + collectionName, failure))
                .onItem().invoke(ledger -> {
                    if (log.isDebugEnabled()) {
                        log.debugf("Fetched %d cost intervals from collection: %s", ledger.size(), collectionName);
                    }
                });
    }

    /**
     * Writes the full ledger and a new notification record in one batch.
     * Both documents are committed together or not at all.
     * <p>
     * On timeout the commit is cancelled, but a commit already sent may still land: the failure then
     * leaves the batch applied and a redelivery appends a second record for the same event.
     *
     * @param collectionName the project collection
     * @param ledger         the updated ledger, replacing the stored one
     * @param record         the notification record to append
     * @return Uni completing once the batch is committed
     */
    public Uni<Void> persist(String collectionName, CostLedger ledger, NotificationRecord record) {
        return Uni.createFrom().deferred(() -> {
                    CollectionReference collection = firestore.collection(collectionName);
                    WriteBatch batch = firestore.batch();
                    batch.set(collection.document(config.ledgerDocumentName()), ledger.toDocument());
                    batch.set(collection.document(), record.toDocument());
                    return ApiFutureAdapter.toUni(batch.commit());
                })
                .ifNoItem().after(config.clientTimeout())
                .failWith(() -> new CostLedgerStoreException("Timed out persisting batch to collection " + collectionName))
                .onItem().invoke(results -> {
                    if (log.isDebugEnabled()) {
                        log.debugf("Committed %d writes to collection: %s", results.size(), collectionName);
                    }
                })
                .onFailure(failure -> !(failure instanceof BaseException))
                .transform(failure -> new CostLedgerStoreException(
                        "Failed to persist cost ledger and notification to collection " + collectionName, failure))
                .replaceWithVoid();
    }

    private CostLedger toLedger(String collectionName, DocumentSnapshot snapshot) {
        if (snapshot == null || !snapshot.exists() || snapshot.getData() == null) {
            return CostLedger.empty();
        }
        Map<String, Double> costs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : snapshot.getData().entrySet()) {
            if (!(entry.getValue() instanceof Number)) {
                throw new CostLedgerStoreException("Cost ledger of collection " + collectionName
                        + " holds a non numeric cost for interval " + entry.getKey());
            }
            costs.put(entry.getKey(), ((Number) entry.getValue()).doubleValue());
        }
        return CostLedger.of(costs);
    }
}
