package com.bbthechange.teaminvite.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationRequest {
    private String requestId;
    private String identity;
    private Long groupId;
    private String redeemCode;
    private boolean rebind;
}
