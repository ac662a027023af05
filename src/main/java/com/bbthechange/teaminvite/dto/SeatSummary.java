package com.bbthechange.teaminvite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Seat totals across the healthy teams of a group (or all teams).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatSummary {
    private int teamCount;
    private int capacity;
    private int confirmed;
    private int pending;
    private int available;
}
