package com.behavior.affinity.cli;

import com.behavior.affinity.api.AffinityEngine;
import com.behavior.affinity.api.BatchRunResult;
import com.behavior.affinity.core.model.TimeWindow;
import com.behavior.affinity.retention.RetentionPolicy;
import com.behavior.affinity.retention.RetentionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point for scheduled jobs and ad-hoc inspection.
 *
 * <pre>
 * batch &lt;tenantName&gt; &lt;cohortName&gt; [windowStart windowEnd]
 * decisions &lt;tenantId&gt; &lt;profileId&gt;
 * profile &lt;tenantId&gt; &lt;profileId|fingerprintId&gt;
 * audience &lt;tenantId&gt; &lt;subjectId&gt; [minScore]
 * gc [stored|decayed]
 * </pre>
 *
 * <p>Without an explicit window, {@code batch} scores the previous full clock
 * hour. Results are printed as JSON. The FalkorDB endpoint comes from
 * {@code AFFINITY_FALKORDB_HOST}, {@code AFFINITY_FALKORDB_PORT} and
 * {@code AFFINITY_GRAPH}.</p>
 */
public class AffinityCli {
    private static final Logger log = LoggerFactory.getLogger(AffinityCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    private static final String USAGE = """
            usage:
              batch <tenantName> <cohortName> [windowStart windowEnd]
              decisions <tenantId> <profileId>
              profile <tenantId> <profileId|fingerprintId>
              audience <tenantId> <subjectId> [minScore]
              gc [stored|decayed]""";

    private final AffinityEngine engine;
    private final PrintStream out;
    private final PrintStream err;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    AffinityCli(AffinityEngine engine, PrintStream out, PrintStream err, Clock clock) {
        this.engine = engine;
        this.out = out;
        this.err = err;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        String host = env.getOrDefault("AFFINITY_FALKORDB_HOST", "localhost");
        int port = Integer.parseInt(env.getOrDefault("AFFINITY_FALKORDB_PORT", "6379"));
        String graph = env.getOrDefault("AFFINITY_GRAPH", "affinity");

        int exitCode;
        try (AffinityEngine engine = AffinityEngine.builder().falkorDB(host, port, graph).build()) {
            exitCode = new AffinityCli(engine, System.out, System.err, Clock.systemUTC()).run(args);
        }
        System.exit(exitCode);
    }

    /**
     * Executes one command.
     *
     * @return the process exit code
     */
    int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        try {
            return switch (args[0]) {
                case "batch" -> batch(args);
                case "decisions" -> requireArgs(args, 3)
                        ? print(engine.getDecisions(args[1], args[2])) : EXIT_USAGE;
                case "profile" -> requireArgs(args, 3)
                        ? print(engine.getProfileAffinity(args[1], args[2])) : EXIT_USAGE;
                case "audience" -> audience(args);
                case "gc" -> gc(args);
                default -> {
                    err.println("unknown command: " + args[0]);
                    err.println(USAGE);
                    yield EXIT_USAGE;
                }
            };
        } catch (IllegalArgumentException | DateTimeParseException e) {
            err.println("invalid argument: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("cli.failed command={} error={}", args[0], e.getMessage(), e);
            err.println("failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int batch(String[] args) {
        TimeWindow window;
        if (args.length == 3) {
            window = TimeWindow.previousHour(clock.instant());
        } else if (args.length == 5) {
            window = TimeWindow.of(Instant.parse(args[3]), Instant.parse(args[4]));
        } else {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        BatchRunResult result = engine.runBatch(args[1], args[2], window);
        return print(result);
    }

    private int audience(String[] args) {
        if (args.length != 3 && args.length != 4) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        double minScore = args.length == 4 ? Double.parseDouble(args[3]) : 0.5;
        return print(engine.findInterested(args[1], args[2], minScore));
    }

    private int gc(String[] args) {
        RetentionPolicy.Evaluation evaluation = args.length > 1
                ? RetentionPolicy.Evaluation.valueOf(args[1].toUpperCase(Locale.ROOT))
                : engine.getOptions().getRetentionPolicy().evaluation();
        RetentionPolicy policy = RetentionPolicy.builder()
                .threshold(engine.getOptions().getRetentionPolicy().threshold())
                .batchSize(engine.getOptions().getRetentionPolicy().batchSize())
                .evaluation(evaluation)
                .build();
        RetentionResult result = engine.collectGarbage(policy);
        print(result);
        return result.failed() ? EXIT_FAILURE : EXIT_OK;
    }

    private boolean requireArgs(String[] args, int expected) {
        if (args.length != expected) {
            err.println(USAGE);
            return false;
        }
        return true;
    }

    private int print(Object value) {
        try {
            out.println(objectMapper.writeValueAsString(value));
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render result as JSON", e);
        }
    }
}
