package net.littleredcomputer.boolprop.solver;

import com.google.common.base.Stopwatch;
import gnu.trove.list.TIntList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

/**
 * Common bookkeeping for search drivers: node counting and throttled progress logging.
 */
public abstract class AbstractSearch {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSearch.class);
    final int logCheckSteps = 1000;
    protected final Solver solver;
    long nodeCount;
    private long lastNodeCount;
    private long lastFailures;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public AbstractSearch setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    AbstractSearch(String name, Solver solver) {
        this.name = name;
        this.solver = solver;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastNodeCount = nodeCount;
        lastFailures = solver.failures();
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
        log.debug("%s finished: %d nodes, %d failures in %s", name, nodeCount, solver.failures(), stopwatch);
    }

    private static final int shownDecisions = 48;

    /** Renders the values tried so far, one digit each for boolean searches, truncated past a fixed width. */
    static String decisionsToString(TIntList values) {
        final int depth = values.size();
        StringBuilder s = new StringBuilder("@").append(depth).append(' ');
        for (int i = 0; i < Math.min(depth, shownDecisions); ++i) s.append(values.get(i));
        if (depth > shownDecisions) s.append("+").append(depth - shownDecisions);
        return s.toString();
    }

    /** Logs the search position if the log interval has elapsed since the last report. */
    void maybeReportProgress(TIntList decisions) {
        final Instant now = Instant.now();
        final long elapsedMillis = Duration.between(lastLogTime, now).toMillis();
        if (elapsedMillis < logInterval.toMillis()) return;
        final long nodes = nodeCount - lastNodeCount;
        final long failed = solver.failures() - lastFailures;
        log.info(() -> new FormattedMessage("%s %s: %d nodes, %d failed since last report (%.0f nodes/sec), %s elapsed",
                name, decisionsToString(decisions), nodes, failed, 1e3 * nodes / Math.max(1, elapsedMillis), stopwatch));
        lastLogTime = now;
        lastNodeCount = nodeCount;
        lastFailures = solver.failures();
    }

    public long nodeCount() {
        return nodeCount;
    }

    /** @return each solution as the values of the searched variables */
    public abstract Stream<int[]> solutions();
}
