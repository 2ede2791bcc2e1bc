package com.cinelink.federation.config;

import com.cinelink.federation.match.KeyMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "federation")
public class FederationProperties {
    private Document document = new Document();
    private Graph graph = new Graph();
    private Reconcile reconcile = new Reconcile();
    private Health health = new Health();
    private Paging paging = new Paging();
    private Match match = new Match();
    private Execution execution = new Execution();

    public Document getDocument() {
        return document;
    }

    public void setDocument(Document document) {
        this.document = document;
    }

    public Graph getGraph() {
        return graph;
    }

    public void setGraph(Graph graph) {
        this.graph = graph;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public void setReconcile(Reconcile reconcile) {
        this.reconcile = reconcile;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Paging getPaging() {
        return paging;
    }

    public void setPaging(Paging paging) {
        this.paging = paging;
    }

    public Match getMatch() {
        return match;
    }

    public void setMatch(Match match) {
        this.match = match;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public static class Document {
        private String collection = "movies";
        private int searchCap = 50;
        private int queryTimeoutMs = 5000;
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 10000;
        private int serverSelectionTimeoutMs = 3000;

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public int getSearchCap() {
            return searchCap;
        }

        public void setSearchCap(int searchCap) {
            this.searchCap = searchCap;
        }

        public int getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(int queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getServerSelectionTimeoutMs() {
            return serverSelectionTimeoutMs;
        }

        public void setServerSelectionTimeoutMs(int serverSelectionTimeoutMs) {
            this.serverSelectionTimeoutMs = serverSelectionTimeoutMs;
        }
    }

    public static class Graph {
        private String database;
        private int queryTimeoutMs = 5000;

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public int getQueryTimeoutMs() {
            return queryTimeoutMs;
        }

        public void setQueryTimeoutMs(int queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
        }
    }

    public static class Reconcile {
        private int documentSampleCap = 1000;
        private int graphSampleCap = 1000;
        private int timeoutMs = 10000;
        private KeyMode keyMode = KeyMode.NORMALIZED;

        public int getDocumentSampleCap() {
            return documentSampleCap;
        }

        public void setDocumentSampleCap(int documentSampleCap) {
            this.documentSampleCap = documentSampleCap;
        }

        public int getGraphSampleCap() {
            return graphSampleCap;
        }

        public void setGraphSampleCap(int graphSampleCap) {
            this.graphSampleCap = graphSampleCap;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public KeyMode getKeyMode() {
            return keyMode;
        }

        public void setKeyMode(KeyMode keyMode) {
            this.keyMode = keyMode;
        }
    }

    public static class Health {
        private int probeTimeoutMs = 3000;

        public int getProbeTimeoutMs() {
            return probeTimeoutMs;
        }

        public void setProbeTimeoutMs(int probeTimeoutMs) {
            this.probeTimeoutMs = probeTimeoutMs;
        }
    }

    public static class Paging {
        private int defaultLimit = 20;
        private int maxLimit = 500;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    public static class Match {
        private boolean quoteSubstring = false;

        public boolean isQuoteSubstring() {
            return quoteSubstring;
        }

        public void setQuoteSubstring(boolean quoteSubstring) {
            this.quoteSubstring = quoteSubstring;
        }
    }

    public static class Execution {
        private int poolSize = 4;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
