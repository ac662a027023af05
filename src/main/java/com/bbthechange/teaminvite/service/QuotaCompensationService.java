package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.service.throttle.RedeemTokenBucket;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Returns a consumed redeem-code use when its invite request finally fails.
 *
 * <p>The durable refund is keyed by request id and applied at most once; only the call that
 * actually applied it touches the token bucket, so repeated compensation of the same request
 * leaves both counts unchanged.</p>
 */
@Service
public class QuotaCompensationService {

    private static final Logger logger = LoggerFactory.getLogger(QuotaCompensationService.class);

    private final RedeemCodeRepository codeRepository;
    private final RedeemTokenBucket tokenBucket;
    private final MeterRegistry meterRegistry;

    public QuotaCompensationService(RedeemCodeRepository codeRepository,
                                    RedeemTokenBucket tokenBucket,
                                    MeterRegistry meterRegistry) {
        this.codeRepository = codeRepository;
        this.tokenBucket = tokenBucket;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return true if this call refunded the use
     */
    public boolean compensate(String requestId, String redeemCode) {
        if (redeemCode == null || requestId == null) {
            return false;
        }
        boolean refunded = codeRepository.refundUse(redeemCode, requestId);
        if (!refunded) {
            logger.debug("Use of code {} for request {} already refunded", redeemCode, requestId);
            meterRegistry.counter("team_invite_compensation_total", "status", "duplicate").increment();
            return false;
        }
        tokenBucket.refund(redeemCode);
        logger.info("Refunded one use of code {} for failed request {}", redeemCode, requestId);
        meterRegistry.counter("team_invite_compensation_total", "status", "refunded").increment();
        return true;
    }
}
