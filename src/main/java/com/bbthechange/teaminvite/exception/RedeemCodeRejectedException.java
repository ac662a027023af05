package com.bbthechange.teaminvite.exception;

/**
 * Thrown synchronously from invite enqueueing when the redeem code cannot be used.
 */
public class RedeemCodeRejectedException extends RuntimeException {

    private final Reason reason;
    private final String code;

    public enum Reason {
        NOT_FOUND,
        INACTIVE,
        EXPIRED,
        EXHAUSTED,
        BOUND_TO_OTHER_IDENTITY,
        RATE_LIMITED,
        BUSY
    }

    public RedeemCodeRejectedException(Reason reason, String code, String message) {
        super(message);
        this.reason = reason;
        this.code = code;
    }

    public Reason getReason() {
        return reason;
    }

    public String getCode() {
        return code;
    }

    public static RedeemCodeRejectedException notFound(String code) {
        return new RedeemCodeRejectedException(Reason.NOT_FOUND, code, "Redeem code not found: " + code);
    }

    public static RedeemCodeRejectedException inactive(String code) {
        return new RedeemCodeRejectedException(Reason.INACTIVE, code, "Redeem code is disabled: " + code);
    }

    public static RedeemCodeRejectedException expired(String code) {
        return new RedeemCodeRejectedException(Reason.EXPIRED, code, "Redeem code has expired: " + code);
    }

    public static RedeemCodeRejectedException exhausted(String code) {
        return new RedeemCodeRejectedException(Reason.EXHAUSTED, code, "Redeem code has no uses left: " + code);
    }

    public static RedeemCodeRejectedException boundToOther(String code) {
        return new RedeemCodeRejectedException(Reason.BOUND_TO_OTHER_IDENTITY, code,
                "Redeem code is bound to another identity: " + code);
    }

    public static RedeemCodeRejectedException rateLimited(String code) {
        return new RedeemCodeRejectedException(Reason.RATE_LIMITED, code, "Too many redemption attempts, try again later");
    }

    public static RedeemCodeRejectedException busy(String code) {
        return new RedeemCodeRejectedException(Reason.BUSY, code, "Redemption is busy, try again shortly");
    }
}
