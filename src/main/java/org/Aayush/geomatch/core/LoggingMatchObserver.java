package org.Aayush.geomatch.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Writes match telemetry to SLF4J.
 */
public final class LoggingMatchObserver implements MatchObserver {
    private static final Logger logger = LoggerFactory.getLogger(LoggingMatchObserver.class);

    @Override
    public void onMatchCompleted(MatchTelemetry telemetry) {
        if (telemetry.emptyInput()) {
            logger.warn("Match skipped: empty input (queries={}, references={})",
                    telemetry.queryCount(), telemetry.referenceCount());
            return;
        }
        logger.info("Matched {} queries against {} references (treeNodes={}, candidates={}) build={}ms query={}ms",
                telemetry.queryCount(),
                telemetry.referenceCount(),
                telemetry.treeNodeCount(),
                telemetry.candidateCount(),
                TimeUnit.NANOSECONDS.toMillis(telemetry.buildNanos()),
                TimeUnit.NANOSECONDS.toMillis(telemetry.queryNanos()));
    }
}
