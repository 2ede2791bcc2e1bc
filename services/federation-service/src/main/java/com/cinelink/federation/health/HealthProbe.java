package com.cinelink.federation.health;

import com.cinelink.federation.config.FederationProperties;
import com.cinelink.federation.document.DocumentStoreClient;
import com.cinelink.federation.graph.GraphStoreClient;
import io.micrometer.core.instrument.Metrics;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Liveness of both stores. Each probe is isolated: whatever happens to one, the other is
 * still run and reported.
 *
 * <p>A ping that outlives its timeout keeps running on its worker, since completable
 * futures cannot interrupt it. Until it finishes, later checks wait on that same ping
 * instead of starting another, so a hanging store holds at most one probe thread.</p>
 */
@Component
public class HealthProbe {
    private static final Logger logger = LoggerFactory.getLogger(HealthProbe.class);

    static final String DOCUMENT_STORE = "mongodb";
    static final String GRAPH_STORE = "neo4j";

    private final DocumentStoreClient documentStoreClient;
    private final GraphStoreClient graphStoreClient;
    private final ExecutorService probeExecutor;
    private final int probeTimeoutMs;
    private final ConcurrentMap<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    public HealthProbe(
        DocumentStoreClient documentStoreClient,
        GraphStoreClient graphStoreClient,
        @Qualifier("healthProbeExecutor") ExecutorService probeExecutor,
        FederationProperties properties
    ) {
        this.documentStoreClient = documentStoreClient;
        this.graphStoreClient = graphStoreClient;
        this.probeExecutor = probeExecutor;
        this.probeTimeoutMs = properties.getHealth().getProbeTimeoutMs();
    }

    public CompositeHealth check() {
        CompletableFuture<Void> documentProbe = submit(DOCUMENT_STORE, documentStoreClient::ping);
        CompletableFuture<Void> graphProbe = submit(GRAPH_STORE, graphStoreClient::ping);
        StoreHealth document = await(documentProbe, DOCUMENT_STORE);
        StoreHealth graph = await(graphProbe, GRAPH_STORE);
        return new CompositeHealth(document, graph);
    }

    private CompletableFuture<Void> submit(String store, Runnable ping) {
        return inFlight.compute(store, (key, previous) -> {
            if (previous != null && !previous.isDone()) {
                return previous;
            }
            try {
                return CompletableFuture.runAsync(ping, probeExecutor);
            } catch (RejectedExecutionException ex) {
                return CompletableFuture.failedFuture(ex);
            }
        });
    }

    private StoreHealth await(CompletableFuture<Void> probe, String store) {
        StoreHealth health;
        try {
            probe.get(probeTimeoutMs, TimeUnit.MILLISECONDS);
            health = StoreHealth.up();
        } catch (TimeoutException ex) {
            // not cancelled: the ping still owns its thread and stays the in-flight probe
            health = StoreHealth.down("health probe timed out after " + probeTimeoutMs + "ms");
        } catch (ExecutionException ex) {
            health = StoreHealth.down(describe(ex.getCause() == null ? ex : ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            health = StoreHealth.down("health probe interrupted");
        }

        Metrics.counter("federation.health.probe.total", "store", store, "outcome", health.connected() ? "up" : "down")
            .increment();
        if (!health.connected()) {
            logger.warn("health.degraded store={} error={}", store, health.error());
        }
        return health;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
