package com.bbthechange.teaminvite.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-identity outcome of a membership invite call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembershipResult {

    public enum Outcome {
        INVITED,
        TRANSIENT_FAILURE,
        TERMINAL_FAILURE
    }

    private String identity;
    private Outcome outcome;
    private String message;

    public static MembershipResult invited(String identity) {
        return new MembershipResult(identity, Outcome.INVITED, null);
    }

    public static MembershipResult transientFailure(String identity, String message) {
        return new MembershipResult(identity, Outcome.TRANSIENT_FAILURE, message);
    }

    public static MembershipResult terminalFailure(String identity, String message) {
        return new MembershipResult(identity, Outcome.TERMINAL_FAILURE, message);
    }

    public boolean isInvited() {
        return outcome == Outcome.INVITED;
    }
}
