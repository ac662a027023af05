package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface WaitingTaskRepository {

    /**
     * Optimistically versioned: a stale copy fails with RepositoryException.
     */
    WaitingTask save(WaitingTask task);

    /**
     * Insert only if no task with this id exists.
     *
     * @return false when the task already exists
     */
    boolean createIfAbsent(WaitingTask task);

    Optional<WaitingTask> findById(String taskId);

    /**
     * Oldest first.
     */
    List<WaitingTask> findByStatus(WaitingTaskStatus status, int limit);

    /**
     * A WAITING or PROCESSING task for the same identity and code, if any.
     */
    Optional<WaitingTask> findOpenByIdentityAndCode(String identity, String redeemCode);

    long countByStatus(WaitingTaskStatus status);

    /**
     * 1-based position of a WAITING task in the global FIFO.
     */
    long queuePosition(WaitingTask task);

    /**
     * Delete SUCCESS and FAILED tasks created before {@code cutoff}.
     *
     * @return number of deleted tasks
     */
    int deleteFinishedBefore(Instant cutoff);
}
