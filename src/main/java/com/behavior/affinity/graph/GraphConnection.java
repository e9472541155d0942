package com.behavior.affinity.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph store holding profiles, tracking events and
 * affinity records. Abstracts the concrete driver so stores can be tested
 * against a stub.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement, with {@code $name} placeholders
     * @param params placeholder values
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column alias.
     *
     * @param query  the Cypher query, with {@code $name} placeholders
     * @param params placeholder values
     * @return result rows
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by scoring, audience and garbage collection
     * queries, if they do not exist yet.
     */
    void createIndexes();

    @Override
    void close();
}
