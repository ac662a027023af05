package com.bbthechange.teaminvite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Seat accounting for one team at a point in time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatCapacity {
    private Long teamId;
    private String teamName;
    private Long groupId;
    private int capacity;
    private int confirmed;
    private int pending;
    private int available;

    public boolean hasAvailableSeats() {
        return available > 0;
    }
}
