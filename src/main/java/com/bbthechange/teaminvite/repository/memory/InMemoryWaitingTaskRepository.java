package com.bbthechange.teaminvite.repository.memory;

import com.bbthechange.teaminvite.exception.RepositoryException;
import com.bbthechange.teaminvite.model.WaitingTask;
import com.bbthechange.teaminvite.model.WaitingTaskStatus;
import com.bbthechange.teaminvite.repository.WaitingTaskRepository;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.TASK_SCHEMA;
import static com.bbthechange.teaminvite.repository.memory.InMemorySeatStore.copy;

public class InMemoryWaitingTaskRepository implements WaitingTaskRepository {

    private static final Comparator<WaitingTask> FIFO = Comparator.comparing(WaitingTask::getGsi1sk);

    private final InMemorySeatStore store;

    public InMemoryWaitingTaskRepository(InMemorySeatStore store) {
        this.store = store;
    }

    @Override
    public WaitingTask save(WaitingTask task) {
        synchronized (store.monitor) {
            WaitingTask stored = store.tasks.get(task.getTaskId());
            Long storedVersion = stored == null ? null : stored.getVersion();
            if (!Objects.equals(storedVersion, task.getVersion())) {
                throw new RepositoryException("Waiting task " + task.getTaskId() + " was modified concurrently");
            }
            task.touch();
            task.setVersion(task.getVersion() == null ? 1L : task.getVersion() + 1);
            store.tasks.put(task.getTaskId(), copy(TASK_SCHEMA, task));
            return task;
        }
    }

    @Override
    public boolean createIfAbsent(WaitingTask task) {
        synchronized (store.monitor) {
            if (store.tasks.containsKey(task.getTaskId())) {
                return false;
            }
            task.setVersion(1L);
            store.tasks.put(task.getTaskId(), copy(TASK_SCHEMA, task));
            return true;
        }
    }

    @Override
    public Optional<WaitingTask> findById(String taskId) {
        return Optional.ofNullable(copy(TASK_SCHEMA, store.tasks.get(taskId)));
    }

    @Override
    public List<WaitingTask> findByStatus(WaitingTaskStatus status, int limit) {
        return store.tasks.values().stream()
                .filter(task -> task.getStatus() == status)
                .sorted(FIFO)
                .limit(limit)
                .map(task -> copy(TASK_SCHEMA, task))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<WaitingTask> findOpenByIdentityAndCode(String identity, String redeemCode) {
        String lookupKey = TeamInviteKeyFactory.getIdentityKey(identity, redeemCode);
        return store.tasks.values().stream()
                .filter(task -> lookupKey.equals(task.getGsi2pk()))
                .filter(task -> !task.getStatus().isFinished())
                .sorted(FIFO)
                .findFirst()
                .map(task -> copy(TASK_SCHEMA, task));
    }

    @Override
    public long countByStatus(WaitingTaskStatus status) {
        return store.tasks.values().stream().filter(task -> task.getStatus() == status).count();
    }

    @Override
    public long queuePosition(WaitingTask task) {
        return store.tasks.values().stream()
                .filter(other -> other.getStatus() == WaitingTaskStatus.WAITING)
                .filter(other -> other.getGsi1sk().compareTo(task.getGsi1sk()) <= 0)
                .count();
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        synchronized (store.monitor) {
            List<String> expired = store.tasks.values().stream()
                    .filter(task -> task.getStatus().isFinished() && task.getCreatedAt().isBefore(cutoff))
                    .map(WaitingTask::getTaskId)
                    .collect(Collectors.toList());
            expired.forEach(store.tasks::remove);
            return expired.size();
        }
    }
}
