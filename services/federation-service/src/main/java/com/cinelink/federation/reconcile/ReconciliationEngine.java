package com.cinelink.federation.reconcile;

import com.cinelink.federation.common.ErrorKind;
import com.cinelink.federation.common.FederationException;
import com.cinelink.federation.config.FederationProperties;
import com.cinelink.federation.document.DocumentStoreClient;
import com.cinelink.federation.graph.GraphStoreClient;
import com.cinelink.federation.match.KeyMode;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Sampled title overlap between the document store and the graph store.
 *
 * <p>The two title sets are read independently, with no shared snapshot, so the report is
 * best effort. Both sides are capped. A failure on either side fails the whole report.</p>
 */
@Service
public class ReconciliationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    // Unicode code point order; String.compareTo misorders titles with supplementary characters.
    static final Comparator<String> CODE_POINT_ORDER =
        (left, right) -> Arrays.compare(left.codePoints().toArray(), right.codePoints().toArray());

    private final DocumentStoreClient documentStoreClient;
    private final GraphStoreClient graphStoreClient;
    private final ExecutorService federationExecutor;
    private final FederationProperties.Reconcile properties;

    public ReconciliationEngine(
        DocumentStoreClient documentStoreClient,
        GraphStoreClient graphStoreClient,
        @Qualifier("federationExecutor") ExecutorService federationExecutor,
        FederationProperties properties
    ) {
        this.documentStoreClient = documentStoreClient;
        this.graphStoreClient = graphStoreClient;
        this.federationExecutor = federationExecutor;
        this.properties = properties.getReconcile();
    }

    public ReconciliationResult reconcile() {
        return reconcile(properties.getDocumentSampleCap(), properties.getGraphSampleCap());
    }

    public ReconciliationResult reconcile(int documentSampleCap, int graphSampleCap) {
        CompletableFuture<Set<String>> documentTitles;
        CompletableFuture<Set<String>> graphTitles;
        try {
            documentTitles = CompletableFuture.supplyAsync(
                () -> documentStoreClient.listAllTitles(documentSampleCap),
                federationExecutor
            );
            graphTitles = CompletableFuture.supplyAsync(
                () -> graphStoreClient.allMovieTitles(graphSampleCap),
                federationExecutor
            );
        } catch (RejectedExecutionException ex) {
            Metrics.counter("federation.reconcile.total", "outcome", "rejected").increment();
            throw FederationException.backend(ex);
        }

        ReconciliationResult result;
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getTimeoutMs());
            result = intersect(
                await(documentTitles, deadline, "mongodb"),
                await(graphTitles, deadline, "neo4j"),
                properties.getKeyMode()
            );
        } catch (FederationException ex) {
            documentTitles.cancel(true);
            graphTitles.cancel(true);
            Metrics.counter("federation.reconcile.total", "outcome", "failed").increment();
            throw ex;
        }

        Metrics.counter("federation.reconcile.total", "outcome", "ok").increment();
        logger.info(
            "reconcile mongodb_count={} neo4j_count={} common_count={} key_mode={}",
            result.documentCount(),
            result.graphCount(),
            result.commonCount(),
            properties.getKeyMode()
        );
        return result;
    }

    /**
     * Intersects two title collections by identity key. Members are reported with the
     * document-side spelling and sorted by Unicode code point.
     */
    public static ReconciliationResult intersect(
        Collection<String> documentTitles,
        Collection<String> graphTitles,
        KeyMode keyMode
    ) {
        Map<String, String> documentByKey = index(documentTitles, keyMode);
        Map<String, String> graphByKey = index(graphTitles, keyMode);

        List<String> common = new ArrayList<>();
        for (Map.Entry<String, String> entry : documentByKey.entrySet()) {
            if (graphByKey.containsKey(entry.getKey())) {
                common.add(entry.getValue());
            }
        }
        common.sort(CODE_POINT_ORDER);
        return new ReconciliationResult(documentByKey.size(), graphByKey.size(), common);
    }

    private static Map<String, String> index(Collection<String> titles, KeyMode keyMode) {
        Map<String, String> byKey = new HashMap<>();
        for (String title : titles) {
            String key = keyMode.keyOf(title);
            if (key == null) {
                continue;
            }
            // several spellings can share a key; keep the smallest so output does not depend on fetch order
            byKey.merge(
                key,
                title,
                (existing, candidate) -> CODE_POINT_ORDER.compare(candidate, existing) < 0 ? candidate : existing
            );
        }
        return byKey;
    }

    private static Set<String> await(CompletableFuture<Set<String>> future, long deadlineNs, String store) {
        long remainingNs = Math.max(0L, deadlineNs - System.nanoTime());
        try {
            return future.get(remainingNs, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            throw new FederationException(ErrorKind.BACKEND, store + " title fetch timed out", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof FederationException federation) {
                throw federation;
            }
            throw FederationException.backend(cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FederationException(ErrorKind.BACKEND, store + " title fetch interrupted", ex);
        }
    }
}
