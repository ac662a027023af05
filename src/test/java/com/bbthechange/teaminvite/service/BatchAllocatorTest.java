package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dto.AllocationResult;
import com.bbthechange.teaminvite.dto.SeatCapacity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchAllocatorTest {

    private final BatchAllocator allocator = new BatchAllocator();

    private static SeatCapacity team(long teamId, int available) {
        return new SeatCapacity(teamId, "team-" + teamId, null, 10, 10 - available, 0, available);
    }

    private static List<String> tasks(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "t" + i).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("allocate")
    class Allocate {

        @Test
        @DisplayName("Should fill the lowest team first, then spill to the next")
        void allocate_FirstTeamSmall_SpillsOver() {
            // Given
            List<SeatCapacity> teams = List.of(team(1L, 1), team(2L, 5));

            // When
            AllocationResult<String> result = allocator.allocate(tasks(3), teams);

            // Then
            assertThat(result.getAllocated()).containsOnlyKeys(1L, 2L);
            assertThat(result.getAllocated().get(1L)).containsExactly("t1");
            assertThat(result.getAllocated().get(2L)).containsExactly("t2", "t3");
            assertThat(result.getUnallocated()).isEmpty();
            assertThat(result.getTotalAvailable()).isEqualTo(6);
        }

        @Test
        @DisplayName("Should order teams by id regardless of input order")
        void allocate_UnorderedInput_UsesAscendingIds() {
            // Given
            List<SeatCapacity> teams = List.of(team(9L, 2), team(4L, 2));

            // When
            AllocationResult<String> result = allocator.allocate(tasks(3), teams);

            // Then
            assertThat(new ArrayList<>(result.getAllocated().keySet())).containsExactly(4L, 9L);
            assertThat(result.getAllocated().get(4L)).containsExactly("t1", "t2");
            assertThat(result.getAllocated().get(9L)).containsExactly("t3");
        }

        @Test
        @DisplayName("Should skip full teams and never create empty assignments")
        void allocate_FullTeams_Skipped() {
            // Given
            List<SeatCapacity> teams = List.of(team(1L, 0), team(2L, 3), team(3L, 4));

            // When
            AllocationResult<String> result = allocator.allocate(tasks(2), teams);

            // Then
            assertThat(result.getAllocated()).containsOnlyKeys(2L);
            assertThat(result.getTotalAvailable()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should leave the tail of the batch unallocated when seats run out")
        void allocate_NotEnoughSeats_TailUnallocated() {
            // Given
            List<SeatCapacity> teams = List.of(team(1L, 1), team(2L, 1));

            // When
            AllocationResult<String> result = allocator.allocate(tasks(4), teams);

            // Then
            assertThat(result.getAllocatedCount()).isEqualTo(2);
            assertThat(result.getUnallocated()).containsExactly("t3", "t4");
        }

        @Test
        @DisplayName("Should leave everything unallocated when no team has seats")
        void allocate_NoTeams_AllUnallocated() {
            // When
            AllocationResult<String> result = allocator.allocate(tasks(2), Collections.emptyList());

            // Then
            assertThat(result.getAllocated()).isEmpty();
            assertThat(result.getUnallocated()).containsExactly("t1", "t2");
            assertThat(result.getTotalAvailable()).isZero();
        }
    }

    @Test
    void allocateGreedy_MatchesSequentialFill() {
        // Given
        List<SeatCapacity> teams = List.of(team(3L, 2), team(1L, 1), team(2L, 0), team(5L, 3));
        List<String> batch = tasks(7);

        // When
        AllocationResult<String> sequential = allocator.allocate(batch, teams);
        AllocationResult<String> greedy = allocator.allocateGreedy(batch, teams);

        // Then
        assertThat(greedy.getAllocated()).isEqualTo(sequential.getAllocated());
        assertThat(greedy.getUnallocated()).isEqualTo(sequential.getUnallocated());
        assertThat(greedy.getUnallocated()).containsExactly("t7");
    }

    @Test
    void allocate_EveryTaskLandsExactlyOnce() {
        // Given
        List<SeatCapacity> teams = List.of(team(1L, 3), team(2L, 2), team(3L, 1));
        List<String> batch = tasks(10);

        // When
        AllocationResult<String> result = allocator.allocate(batch, teams);

        // Then
        List<String> placed = new ArrayList<>(result.getUnallocated());
        result.getAllocated().values().forEach(placed::addAll);
        assertThat(placed).containsExactlyInAnyOrderElementsOf(batch);
        assertThat(result.getAllocatedCount()).isEqualTo(6);
    }
}
