package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dto.ReservationRequest;
import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.WaitingTaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Durable FIFO of invite requests that found no free seat.
 */
@Service
public class WaitingQueueService {

    private static final Logger logger = LoggerFactory.getLogger(WaitingQueueService.class);
    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final WaitingTaskRepository taskRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicLong parkSequence = new AtomicLong();

    public WaitingQueueService(WaitingTaskRepository taskRepository, MeterRegistry meterRegistry, Clock clock) {
        this.taskRepository = taskRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Park a request. A task already promoted from the queue goes back to WAITING at its original
     * position; a new request gets a task keyed by its request id.
     *
     * @return the parked task
     */
    public WaitingTask park(ReservationRequest request, String waitingTaskId, Long oldTeamId, String reason) {
        if (waitingTaskId != null) {
            Optional<WaitingTask> requeued = update(waitingTaskId, task -> {
                task.setStatus(WaitingTaskStatus.WAITING);
                task.setErrorMessage(reason);
                return true;
            });
            if (requeued.isPresent()) {
                logger.info("Request {} returned to waiting queue: {}", request.getRequestId(), reason);
                meterRegistry.counter("team_invite_waiting_total", "status", "requeued").increment();
                return requeued.get();
            }
        }

        WaitingTask task = new WaitingTask(request.getRequestId(), request.getIdentity(),
                request.getGroupId(), request.getRedeemCode());
        task.setRebind(request.isRebind());
        task.setOldTeamId(oldTeamId);
        task.setErrorMessage(reason);
        task.setCreatedAt(clock.instant());
        task.setQueueSequence(parkSequence.incrementAndGet());
        task.setUpdatedAt(task.getCreatedAt());

        if (taskRepository.createIfAbsent(task)) {
            logger.info("Request {} for {} parked in waiting queue: {}", request.getRequestId(), request.getIdentity(), reason);
            meterRegistry.counter("team_invite_waiting_total", "status", "parked").increment();
            return task;
        }
        return taskRepository.findById(task.getTaskId()).orElse(task);
    }

    /**
     * Mark a waiting task finished. Unknown ids and already finished tasks are left alone.
     */
    public void complete(String waitingTaskId, WaitingTaskStatus status, String errorMessage) {
        if (waitingTaskId == null) {
            return;
        }
        update(waitingTaskId, task -> {
            if (task.getStatus() != null && task.getStatus().isFinished()) {
                return false;
            }
            task.setStatus(status);
            task.setErrorMessage(errorMessage);
            task.setProcessedAt(clock.instant());
            return true;
        }).ifPresent(task -> logger.info("Waiting task {} finished as {}", waitingTaskId, status));
    }

    public long position(WaitingTask task) {
        return taskRepository.queuePosition(task);
    }

    public Optional<WaitingTask> findOpen(String identity, String redeemCode) {
        return taskRepository.findOpenByIdentityAndCode(identity, redeemCode);
    }

    public Map<WaitingTaskStatus, Long> depth() {
        Map<WaitingTaskStatus, Long> depth = new EnumMap<>(WaitingTaskStatus.class);
        for (WaitingTaskStatus status : WaitingTaskStatus.values()) {
            depth.put(status, taskRepository.countByStatus(status));
        }
        return depth;
    }

    /**
     * Read-modify-write under the task's version, re-reading after a concurrent update.
     * Empty when the task is missing or {@code change} declined to modify it.
     */
    private Optional<WaitingTask> update(String taskId, Predicate<WaitingTask> change) {
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<WaitingTask> current = taskRepository.findById(taskId);
            if (current.isEmpty()) {
                logger.warn("Waiting task {} not found", taskId);
                return Optional.empty();
            }
            WaitingTask task = current.get();
            if (!change.test(task)) {
                return Optional.empty();
            }
            task.setUpdatedAt(clock.instant());
            try {
                return Optional.of(taskRepository.save(task));
            } catch (RepositoryException e) {
                logger.debug("Waiting task {} changed concurrently (attempt {})", taskId, attempt);
            }
        }
        throw new RepositoryException("Waiting task " + taskId + " kept changing concurrently");
    }
}
