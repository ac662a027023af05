package com.bbthechange.teaminvite.service.throttle;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.Coordinator;
import com.bbthechange.teaminvite.coordination.DecrementResult;
import com.bbthechange.teaminvite.exception.CoordinationUnavailableException;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * Per-code token bucket holding the remaining uses of each limited redeem code.
 *
 * <p>Consumption is a single atomic decrement-if-positive and fails closed. A bucket lost from
 * the coordination service is rebuilt from the durable {@code maxUses - usedCount}. Codes
 * with unlimited uses never touch the bucket.</p>
 */
@Component
public class RedeemTokenBucket {

    private static final Logger logger = LoggerFactory.getLogger(RedeemTokenBucket.class);

    private final Coordinator coordinator;
    private final RedeemCodeRepository codeRepository;
    private final TeamInviteProperties.Throttle settings;
    private final MeterRegistry meterRegistry;

    public RedeemTokenBucket(Coordinator coordinator,
                             RedeemCodeRepository codeRepository,
                             TeamInviteProperties properties,
                             MeterRegistry meterRegistry) {
        this.coordinator = coordinator;
        this.codeRepository = codeRepository;
        this.settings = properties.getThrottle();
        this.meterRegistry = meterRegistry;
    }

    static String bucketKey(String code) {
        return "redeem:" + code + ":remaining";
    }

    /**
     * Take one use of {@code code}.
     *
     * @return false when the code is exhausted or the bucket cannot be reached
     */
    public boolean tryConsume(RedeemCode code) {
        if (code.isUnlimited()) {
            return true;
        }
        String key = bucketKey(code.getCode());
        try {
            DecrementResult result = coordinator.decrementIfPositive(key);
            if (result == DecrementResult.MISSING) {
                rebuild(code.getCode());
                result = coordinator.decrementIfPositive(key);
            }
            meterRegistry.counter("team_invite_token_bucket_total", "status", result.name().toLowerCase()).increment();
            if (result != DecrementResult.DECREMENTED) {
                logger.info("Redeem code {} rejected by token bucket: {}", code.getCode(), result);
                return false;
            }
            return true;
        } catch (CoordinationUnavailableException e) {
            logger.error("Token bucket unavailable for code {}, rejecting redemption", code.getCode(), e);
            meterRegistry.counter("team_invite_token_bucket_total", "status", "unavailable").increment();
            return false;
        }
    }

    /**
     * Return one use to the bucket. A missing bucket is left alone; it is rebuilt from the
     * durable count, which the caller refunds first.
     */
    public void refund(String code) {
        try {
            OptionalLong remaining = coordinator.incrementIfPresent(bucketKey(code), 1);
            if (remaining.isPresent()) {
                logger.info("Refunded one token to code {}, {} remaining", code, remaining.getAsLong());
            } else {
                logger.debug("No live bucket for code {}, refund left to durable count", code);
            }
        } catch (CoordinationUnavailableException e) {
            logger.warn("Could not refund token for code {}: {}", code, e.getMessage());
        }
    }

    /**
     * Seed the bucket for a code if it has none yet.
     */
    public void initialize(RedeemCode code) {
        if (code.isUnlimited()) {
            return;
        }
        if (coordinator.initCounter(bucketKey(code.getCode()), code.getRemainingUses(), settings.getTokenTtl())) {
            logger.info("Initialized token bucket for code {} with {} uses", code.getCode(), code.getRemainingUses());
        }
    }

    public OptionalLong remaining(String code) {
        return coordinator.getCounter(bucketKey(code));
    }

    private void rebuild(String code) {
        codeRepository.findByCode(code).ifPresent(durable -> {
            logger.info("Rebuilding token bucket for code {} from durable count ({} remaining)",
                    code, durable.getRemainingUses());
            initialize(durable);
        });
    }
}
