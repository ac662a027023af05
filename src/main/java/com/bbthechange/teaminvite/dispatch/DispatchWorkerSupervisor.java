package com.bbthechange.teaminvite.dispatch;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts the configured number of dispatch workers with the application context and stops
 * them with it.
 */
@Component
@ConditionalOnProperty(name = "team-invite.dispatch.enabled", havingValue = "true", matchIfMissing = true)
public class DispatchWorkerSupervisor implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(DispatchWorkerSupervisor.class);

    private final InviteTaskChannel channel;
    private final InviteBatchProcessor processor;
    private final TeamInviteProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final List<DispatchWorker> workers = new ArrayList<>();
    private ExecutorService workerThreads;
    private ExecutorService batchThreads;
    private volatile boolean running;

    public DispatchWorkerSupervisor(InviteTaskChannel channel,
                                    InviteBatchProcessor processor,
                                    TeamInviteProperties properties,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.channel = channel;
        this.processor = processor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        int count = properties.getDispatch().getWorkers();
        workerThreads = Executors.newFixedThreadPool(count, named("invite-dispatch-"));
        batchThreads = Executors.newCachedThreadPool(named("invite-batch-"));
        for (int i = 0; i < count; i++) {
            DispatchWorker worker = new DispatchWorker("worker-" + i, channel, processor, batchThreads,
                    properties, meterRegistry, clock);
            workers.add(worker);
            workerThreads.submit(worker);
        }
        running = true;
        logger.info("Started {} dispatch workers", count);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        workers.forEach(DispatchWorker::stop);
        workerThreads.shutdown();
        try {
            long waitMillis = properties.getDispatch().getBatchMaxWait().toMillis() + 5000;
            if (!workerThreads.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Dispatch workers did not stop in time, interrupting");
                workerThreads.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerThreads.shutdownNow();
        }
        batchThreads.shutdownNow();
        workers.clear();
        running = false;
        logger.info("Dispatch workers stopped, {} messages left in channel", channel.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
