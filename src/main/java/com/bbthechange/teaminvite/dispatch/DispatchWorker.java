package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.queue.InviteTaskMessage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains batches from the task channel and runs each under the soft and hard time limits.
 *
 * <p>The batch runs on a separate thread. When it overruns the hard limit the thread is
 * interrupted and every message it had not settled is failed over to the retry path, releasing
 * any seat it had reserved.</p>
 */
public class DispatchWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DispatchWorker.class);
    static final String HARD_LIMIT_EXCEEDED = "hard time limit exceeded";

    private final String name;
    private final InviteTaskChannel channel;
    private final InviteBatchProcessor processor;
    private final ExecutorService batchExecutor;
    private final TeamInviteProperties.Dispatch settings;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private volatile boolean running = true;

    public DispatchWorker(String name,
                          InviteTaskChannel channel,
                          InviteBatchProcessor processor,
                          ExecutorService batchExecutor,
                          TeamInviteProperties properties,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.name = name;
        this.channel = channel;
        this.processor = processor;
        this.batchExecutor = batchExecutor;
        this.settings = properties.getDispatch();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public void run() {
        logger.info("Dispatch worker {} started", name);
        while (running && !Thread.currentThread().isInterrupted()) {
            List<InviteTaskMessage> batch;
            try {
                batch = channel.drainBatch(settings.getBatchSize(), settings.getBatchMaxWait());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (batch.isEmpty()) {
                continue;
            }
            try {
                runBatch(batch);
            } catch (RuntimeException e) {
                logger.error("Dispatch worker {} failed to settle a batch of {}", name, batch.size(), e);
            }
        }
        logger.info("Dispatch worker {} stopped", name);
    }

    public void stop() {
        running = false;
    }

    void runBatch(List<InviteTaskMessage> batch) {
        for (InviteTaskMessage message : batch) {
            if (message.getMessageId() == null) {
                message.setMessageId(UUID.randomUUID().toString());
            }
        }

        BatchProgress progress = new BatchProgress();
        TaskDeadline deadline = new TaskDeadline(clock, settings.getSoftTimeLimit());
        long started = System.nanoTime();
        Future<?> future = batchExecutor.submit(() -> processor.process(batch, deadline, progress));

        try {
            future.get(settings.getHardTimeLimit().toMillis(), TimeUnit.MILLISECONDS);
            meterRegistry.timer("team_invite_batch_duration", "status", "completed")
                    .record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            logger.error("Batch of {} exceeded the hard time limit of {}, abandoning it",
                    batch.size(), settings.getHardTimeLimit());
            future.cancel(true);
            processor.abandonUnsettled(batch, progress, HARD_LIMIT_EXCEEDED);
            meterRegistry.counter("team_invite_batch_total", "status", "timed_out").increment();
        } catch (ExecutionException e) {
            logger.error("Batch of {} failed", batch.size(), e.getCause());
            processor.abandonUnsettled(batch, progress, "batch failed: " + e.getCause().getMessage());
            meterRegistry.counter("team_invite_batch_total", "status", "error").increment();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            processor.abandonUnsettled(batch, progress, "worker stopped");
        }
    }
}
