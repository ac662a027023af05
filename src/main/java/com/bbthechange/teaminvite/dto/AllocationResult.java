package com.bbthechange.teaminvite.dto;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Tasks split across teams. {@code allocated} iterates in ascending team id order and never
 * holds an empty list.
 */
public class AllocationResult<T> {

    private final Map<Long, List<T>> allocated;
    private final List<T> unallocated;
    private final int totalAvailable;

    public AllocationResult(Map<Long, List<T>> allocated, List<T> unallocated, int totalAvailable) {
        this.allocated = Collections.unmodifiableMap(allocated);
        this.unallocated = Collections.unmodifiableList(unallocated);
        this.totalAvailable = totalAvailable;
    }

    public Map<Long, List<T>> getAllocated() {
        return allocated;
    }

    public List<T> getUnallocated() {
        return unallocated;
    }

    public int getTotalAvailable() {
        return totalAvailable;
    }

    public int getAllocatedCount() {
        return allocated.values().stream().mapToInt(List::size).sum();
    }
}
