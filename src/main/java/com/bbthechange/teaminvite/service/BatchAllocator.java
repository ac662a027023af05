package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.dto.AllocationResult;
import com.bbthechange.teaminvite.dto.SeatCapacity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Splits a batch of tasks over teams with free seats. Deterministic for a given input order
 * and capacity snapshot; every task ends up in exactly one place.
 */
@Component
public class BatchAllocator {

    private static final Logger logger = LoggerFactory.getLogger(BatchAllocator.class);

    /**
     * Sequential fill: teams in ascending id order, each taking tasks from the front of the
     * queue until its free seats run out.
     */
    public <T> AllocationResult<T> allocate(List<T> tasks, List<SeatCapacity> teams) {
        List<SeatCapacity> open = openTeams(teams);
        int totalAvailable = open.stream().mapToInt(SeatCapacity::getAvailable).sum();

        Deque<T> queue = new ArrayDeque<>(tasks);
        Map<Long, List<T>> allocated = new LinkedHashMap<>();
        for (SeatCapacity team : open) {
            int remaining = team.getAvailable();
            List<T> assigned = new ArrayList<>();
            while (remaining > 0 && !queue.isEmpty()) {
                assigned.add(queue.pollFirst());
                remaining--;
            }
            if (!assigned.isEmpty()) {
                allocated.put(team.getTeamId(), assigned);
            }
            if (queue.isEmpty()) {
                break;
            }
        }

        AllocationResult<T> result = new AllocationResult<>(allocated, new ArrayList<>(queue), totalAvailable);
        logAllocation(tasks.size(), result);
        return result;
    }

    /**
     * Greedy slicing: each team takes {@code min(remaining, available)} tasks in one slice.
     * Produces the same assignment as {@link #allocate} but without per-task iteration.
     */
    public <T> AllocationResult<T> allocateGreedy(List<T> tasks, List<SeatCapacity> teams) {
        List<SeatCapacity> open = openTeams(teams);
        int totalAvailable = open.stream().mapToInt(SeatCapacity::getAvailable).sum();

        Map<Long, List<T>> allocated = new LinkedHashMap<>();
        int index = 0;
        for (SeatCapacity team : open) {
            if (index >= tasks.size()) {
                break;
            }
            int take = Math.min(tasks.size() - index, team.getAvailable());
            allocated.put(team.getTeamId(), new ArrayList<>(tasks.subList(index, index + take)));
            index += take;
        }

        AllocationResult<T> result = new AllocationResult<>(allocated,
                new ArrayList<>(tasks.subList(index, tasks.size())), totalAvailable);
        logAllocation(tasks.size(), result);
        return result;
    }

    private static List<SeatCapacity> openTeams(List<SeatCapacity> teams) {
        return teams.stream()
                .filter(SeatCapacity::hasAvailableSeats)
                .sorted(Comparator.comparing(SeatCapacity::getTeamId))
                .collect(Collectors.toList());
    }

    private static <T> void logAllocation(int taskCount, AllocationResult<T> result) {
        if (!result.getUnallocated().isEmpty()) {
            logger.info("Allocated {}/{} tasks across {} teams, {} left without seats (available {})",
                    result.getAllocatedCount(), taskCount, result.getAllocated().size(),
                    result.getUnallocated().size(), result.getTotalAvailable());
        } else {
            logger.debug("Allocated {} tasks across {} teams", taskCount, result.getAllocated().size());
        }
    }
}
