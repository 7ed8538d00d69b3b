package com.csg.finops.budgetcap.external.clients;

import com.csg.finops.budgetcap.domain.util.StructuredLogger;
import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.common.util.concurrent.MoreExecutors;
import io.smallrye.mutiny.Uni;

import java.util.Map;

/**
 * Bridges Google client {@link ApiFuture}s to Mutiny.
 * <p>
 * Callbacks run on the client's completing thread with the subscriber's logging context restored.
 * Cancelling the subscription, a timeout included, cancels the future; a call already sent may still
 * be applied by the server.
 */
public final class ApiFutureAdapter {

    private ApiFutureAdapter() {
    }

    public static <T> Uni<T> toUni(ApiFuture<T> future) {
        return Uni.createFrom().emitter(emitter -> {
            Map<String, Object> context = StructuredLogger.captureContext();
            Thread subscribingThread = Thread.currentThread();
            emitter.onTermination(() -> future.cancel(false));

            ApiFutures.addCallback(future, new ApiFutureCallback<T>() {
                @Override
                public void onFailure(Throwable t) {
                    runInContext(() -> emitter.fail(t));
                }

                @Override
                public void onSuccess(T result) {
                    runInContext(() -> emitter.complete(result));
                }

                private void runInContext(Runnable action) {
                    if (Thread.currentThread() == subscribingThread) {
                        action.run();
                    } else {
                        StructuredLogger.runWithContext(context, action);
                    }
                }
            }, MoreExecutors.directExecutor());
        });
    }
}
