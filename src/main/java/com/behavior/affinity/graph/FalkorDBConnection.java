package com.behavior.affinity.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * FalkorDB implementation using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\w+)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating affinity indexes on graph {}", graphName);

        safeExecute("CREATE INDEX FOR (t:Tenant) ON (t.name)");
        safeExecute("CREATE INDEX FOR (p:Profile) ON (p.tenantId)");
        safeExecute("CREATE INDEX FOR (p:Profile) ON (p.fingerprintId)");
        safeExecute("CREATE INDEX FOR (ev:TrackingEvent) ON (ev.timestampMillis)");
        safeExecute("CREATE INDEX FOR (m:EventMetric) ON (m.eventName)");

        safeExecute("CREATE INDEX FOR (r:AffinityRecord) ON (r.tenantId)");
        safeExecute("CREATE INDEX FOR (r:AffinityRecord) ON (r.profileId)");
        safeExecute("CREATE INDEX FOR (r:AffinityRecord) ON (r.subjectId)");
        safeExecute("CREATE INDEX FOR (r:AffinityRecord) ON (r.interestScore)");

        log.info("Index creation complete");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders with literal values in a single
     * pass, so text inlined from one value is never rescanned for another
     * placeholder. Names without a parameter are left as they are.
     */
    static String processParams(String query, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> items) {
            return items.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed graph={}", graphName);
    }
}
