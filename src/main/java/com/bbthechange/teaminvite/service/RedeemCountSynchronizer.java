package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.coordination.ExclusiveJobRunner;
import com.bbthechange.teaminvite.model.RedeemCode;
import com.bbthechange.teaminvite.repository.RedeemCodeRepository;
import com.bbthechange.teaminvite.service.throttle.RedeemTokenBucket;
import com.bbthechange.teaminvite.service.throttle.RedemptionSemaphore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Copies live token bucket counts back into the durable used count of each limited code.
 *
 * <p>A redemption takes its token before it records the use, so a code is only synced while no
 * redemption permit is held, and the write applies only if the durable count has not moved since
 * it was read.</p>
 */
@Service
public class RedeemCountSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(RedeemCountSynchronizer.class);
    static final String LOCK_NAME = "lock:redeem-count-sync";

    private final ExclusiveJobRunner jobRunner;
    private final RedeemCodeRepository codeRepository;
    private final RedeemTokenBucket tokenBucket;
    private final RedemptionSemaphore semaphore;
    private final TeamInviteProperties properties;
    private final MeterRegistry meterRegistry;

    public RedeemCountSynchronizer(ExclusiveJobRunner jobRunner,
                                   RedeemCodeRepository codeRepository,
                                   RedeemTokenBucket tokenBucket,
                                   RedemptionSemaphore semaphore,
                                   TeamInviteProperties properties,
                                   MeterRegistry meterRegistry) {
        this.jobRunner = jobRunner;
        this.codeRepository = codeRepository;
        this.tokenBucket = tokenBucket;
        this.semaphore = semaphore;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedDelayString = "${team-invite.reconciler.count-sync-interval:PT5M}", initialDelayString = "PT2M")
    public void scheduledSync() {
        if (!properties.getReconciler().isEnabled()) {
            return;
        }
        try {
            sync();
        } catch (Exception e) {
            logger.error("Error syncing redeem code counts", e);
            meterRegistry.counter("team_invite_count_sync_total", "status", "error").increment();
        }
    }

    /**
     * @return number of codes whose durable count was corrected
     */
    public int sync() {
        return jobRunner.runExclusively(LOCK_NAME, properties.getReconciler().getLockTtl(), this::syncCounts)
                .orElse(0);
    }

    private int syncCounts() {
        int corrected = 0;
        int deferred = 0;
        for (RedeemCode code : codeRepository.findActive()) {
            if (code.isUnlimited()) {
                continue;
            }
            OptionalLong remaining = tokenBucket.remaining(code.getCode());
            if (remaining.isEmpty()) {
                continue;
            }
            if (semaphore.inFlight() > 0) {
                deferred++;
                continue;
            }
            Optional<RedeemCode> current = codeRepository.findByCode(code.getCode());
            if (current.isEmpty()) {
                continue;
            }
            int used = (int) Math.max(0, Math.min(code.getMaxUses(), code.getMaxUses() - remaining.getAsLong()));
            int durable = current.get().getUsedCount() == null ? 0 : current.get().getUsedCount();
            if (used == durable) {
                continue;
            }
            if (codeRepository.updateUsedCount(code.getCode(), durable, used)) {
                logger.info("Synced used count of code {}: {} -> {}", code.getCode(), durable, used);
                corrected++;
            } else {
                deferred++;
            }
        }
        if (deferred > 0) {
            logger.debug("Deferred count sync of {} codes with redemptions in flight", deferred);
        }
        meterRegistry.counter("team_invite_count_sync_total", "status", "success").increment();
        return corrected;
    }
}
