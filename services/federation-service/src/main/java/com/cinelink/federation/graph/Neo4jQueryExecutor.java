package com.cinelink.federation.graph;

import com.cinelink.federation.common.FederationException;
import com.cinelink.federation.config.FederationProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Neo4jQueryExecutor implements GraphQueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(Neo4jQueryExecutor.class);

    private final Driver driver;
    private final SessionConfig sessionConfig;
    private final TransactionConfig transactionConfig;

    public Neo4jQueryExecutor(Driver driver, FederationProperties properties) {
        this.driver = driver;
        this.sessionConfig = sessionConfig(properties.getGraph().getDatabase());
        this.transactionConfig = TransactionConfig.builder()
            .withTimeout(Duration.ofMillis(properties.getGraph().getQueryTimeoutMs()))
            .build();
    }

    @Override
    public List<Map<String, Object>> read(String cypher, Map<String, Object> params) {
        long started = System.nanoTime();
        try (Session session = driver.session(sessionConfig)) {
            List<Map<String, Object>> rows = session.executeRead(
                tx -> tx.run(cypher, params).list(Record::asMap),
                transactionConfig
            );
            logger.debug("graph.read rows={} took_ms={}", rows.size(), (System.nanoTime() - started) / 1_000_000L);
            return rows;
        } catch (Neo4jException ex) {
            throw FederationException.backend(ex);
        }
    }

    private static SessionConfig sessionConfig(String database) {
        SessionConfig.Builder builder = SessionConfig.builder().withDefaultAccessMode(AccessMode.READ);
        if (database != null && !database.isBlank()) {
            builder.withDatabase(database);
        }
        return builder.build();
    }
}
