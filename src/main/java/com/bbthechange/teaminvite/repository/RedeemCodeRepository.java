package com.bbthechange.teaminvite.repository;

import com.bbthechange.teaminvite.model.RedeemCode;

import java.util.List;
import java.util.Optional;

public interface RedeemCodeRepository {

    Optional<RedeemCode> findByCode(String code);

    RedeemCode save(RedeemCode code);

    List<RedeemCode> findActive();

    /**
     * Durably consume one use and bind the code to {@code identity} if unbound.
     *
     * @return false when the code has no uses left
     */
    boolean recordUse(String code, String identity);

    /**
     * Give back one use. Idempotent per {@code refundKey}.
     *
     * @return true only for the call that actually applied the refund
     */
    boolean refundUse(String code, String refundKey);

    /**
     * Overwrite the used count, but only while it still equals {@code expectedUsedCount}.
     *
     * @return false if the count moved or the code is gone
     */
    boolean updateUsedCount(String code, int expectedUsedCount, int usedCount);
}
