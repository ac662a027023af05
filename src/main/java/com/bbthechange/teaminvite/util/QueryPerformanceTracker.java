package com.bbthechange.teaminvite.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times seat-store operations and flags slow ones.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 250L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run {@code queryOperation} and record its duration under {@code seatstore.query.duration}.
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;
            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow seat store call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("Seat store call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;
        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("Seat store call failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        } finally {
            sample.stop(Timer.builder("seatstore.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }

    public void trackWrite(String operation, String table, Runnable writeOperation) {
        trackQuery(operation, table, () -> {
            writeOperation.run();
            return null;
        });
    }
}
