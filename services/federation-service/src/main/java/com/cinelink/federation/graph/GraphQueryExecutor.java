package com.cinelink.federation.graph;

import java.util.List;
import java.util.Map;

/**
 * Runs one read-only Cypher statement and returns its rows as plain Java maps.
 * Each call holds its session only for the duration of the statement.
 */
public interface GraphQueryExecutor {

    List<Map<String, Object>> read(String cypher, Map<String, Object> params);

    default List<Map<String, Object>> read(String cypher) {
        return read(cypher, Map.of());
    }
}
