package com.bbthechange.teaminvite.coordination;

import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExclusiveJobRunnerTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    @Mock
    private Coordinator coordinator;

    @Test
    void runExclusively_LockTaken_RunsJobAndReleases() {
        // Given
        MutexLease lease = new MutexLease("lock:job", "t");
        when(coordinator.tryLock("lock:job", TTL)).thenReturn(Optional.of(lease));
        ExclusiveJobRunner runner = new ExclusiveJobRunner(coordinator);

        // When
        Optional<Integer> result = runner.runExclusively("lock:job", TTL, () -> 3);

        // Then
        assertThat(result).contains(3);
        verify(coordinator).unlock(lease);
    }

    @Test
    void runExclusively_LockHeldElsewhere_Skips() {
        // Given
        when(coordinator.tryLock("lock:job", TTL)).thenReturn(Optional.empty());
        AtomicInteger runs = new AtomicInteger();

        // When
        Optional<Integer> result = new ExclusiveJobRunner(coordinator)
                .runExclusively("lock:job", TTL, runs::incrementAndGet);

        // Then
        assertThat(result).isEmpty();
        assertThat(runs).hasValue(0);
        verify(coordinator, never()).unlock(any());
    }

    @Test
    void runExclusively_CoordinationDown_Skips() {
        // Given
        when(coordinator.tryLock("lock:job", TTL)).thenThrow(new CoordinationUnavailableException("down"));

        // Then
        assertThat(new ExclusiveJobRunner(coordinator).runExclusively("lock:job", TTL, () -> 1)).isEmpty();
    }

    @Test
    void runExclusively_JobThrows_StillReleases() {
        // Given
        MutexLease lease = new MutexLease("lock:job", "t");
        when(coordinator.tryLock("lock:job", TTL)).thenReturn(Optional.of(lease));
        ExclusiveJobRunner runner = new ExclusiveJobRunner(coordinator);

        // When/Then
        assertThatThrownBy(() -> runner.runExclusively("lock:job", TTL, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        verify(coordinator).unlock(lease);
    }

    @Test
    void runExclusively_UnlockFails_ResultStillReturned() {
        // Given
        MutexLease lease = new MutexLease("lock:job", "t");
        when(coordinator.tryLock("lock:job", TTL)).thenReturn(Optional.of(lease));
        doThrow(new CoordinationUnavailableException("down")).when(coordinator).unlock(lease);

        // Then
        assertThat(new ExclusiveJobRunner(coordinator).runExclusively("lock:job", TTL, () -> "done"))
            .contains("done");
    }
}
