package com.bbthechange.teaminvite.service;

import com.bbthechange.teaminvite.config.TeamInviteProperties;
import com.bbthechange.teaminvite.dto.SeatCapacity;
import com.bbthechange.teaminvite.dto.SeatSummary;
import com.bbthechange.teaminvite.model.InviteRecord;
import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.repository.InviteRecordRepository;
import com.bbthechange.teaminvite.repository.TeamMemberRepository;
import com.bbthechange.teaminvite.repository.TeamRepository;
import com.bbthechange.teaminvite.repository.TeamSeatState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Capacity ledger: derives per-team seat availability from confirmed members and recent
 * invites. Pure reads; never writes.
 *
 * <p>available = max(0, capacity - confirmed - pending), where pending counts distinct
 * identities with a RESERVED or SUCCESS invite inside the lookback window that are not
 * already confirmed members.</p>
 */
@Service
public class SeatLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(SeatLedgerService.class);

    public static final String SUMMARY_CACHE = "seatSummary";
    /** Group key used for teams without a group. */
    public static final long UNGROUPED = 0L;

    static final Comparator<SeatCapacity> FULL_LAST_THEN_ID =
            Comparator.comparing((SeatCapacity c) -> c.getAvailable() <= 0)
                    .thenComparing(SeatCapacity::getTeamId);

    private final TeamRepository teamRepository;
    private final TeamMemberRepository memberRepository;
    private final InviteRecordRepository inviteRepository;
    private final TeamInviteProperties properties;
    private final Clock clock;

    public SeatLedgerService(TeamRepository teamRepository,
                             TeamMemberRepository memberRepository,
                             InviteRecordRepository inviteRepository,
                             TeamInviteProperties properties,
                             Clock clock) {
        this.teamRepository = teamRepository;
        this.memberRepository = memberRepository;
        this.inviteRepository = inviteRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Start of the pending lookback window as of now.
     */
    public Instant pendingWindowStart() {
        return clock.instant().minus(properties.getLedger().getPendingWindow());
    }

    /**
     * Capacity of a team from a state snapshot, e.g. one read under a seat transaction lock.
     */
    public SeatCapacity computeCapacity(TeamSeatState state) {
        Team team = state.getTeam();
        Set<String> members = state.getMemberIdentities();
        Instant windowStart = pendingWindowStart();

        long pending = state.getRecentInvites().stream()
                .filter(invite -> invite.getStatus() != null && invite.getStatus().holdsSeat())
                .filter(invite -> !invite.getCreatedAt().isBefore(windowStart))
                .map(InviteRecord::getIdentity)
                .filter(identity -> !members.contains(identity))
                .distinct()
                .count();

        int confirmed = members.size();
        int available = Math.max(0, team.getCapacity() - confirmed - (int) pending);
        return new SeatCapacity(team.getTeamId(), team.getName(), team.getGroupId(),
                team.getCapacity(), confirmed, (int) pending, available);
    }

    /**
     * Unlocked snapshot of one team's capacity.
     */
    public SeatCapacity capacityOf(Team team) {
        Set<String> members = memberRepository.findByTeamId(team.getTeamId()).stream()
                .map(TeamMember::getIdentity)
                .collect(Collectors.toSet());
        List<InviteRecord> recent = inviteRepository.findByTeamIdSince(team.getTeamId(), pendingWindowStart());
        return computeCapacity(new TeamSeatState(team, members, recent));
    }

    /**
     * Capacities of a group's teams (all teams when {@code groupId} is null), teams with free
     * seats first, each part in ascending id order.
     */
    public List<SeatCapacity> listCapacities(Long groupId, boolean healthyOnly) {
        return teamRepository.findByGroup(groupId).stream()
                .filter(team -> !healthyOnly || team.isHealthy())
                .map(this::capacityOf)
                .sorted(FULL_LAST_THEN_ID)
                .collect(Collectors.toList());
    }

    @Cacheable(cacheNames = SUMMARY_CACHE, key = "#groupId == null ? 'all' : #groupId")
    public SeatSummary summarize(Long groupId) {
        List<SeatCapacity> capacities = listCapacities(groupId, true);
        SeatSummary summary = new SeatSummary(
                capacities.size(),
                capacities.stream().mapToInt(SeatCapacity::getCapacity).sum(),
                capacities.stream().mapToInt(SeatCapacity::getConfirmed).sum(),
                capacities.stream().mapToInt(SeatCapacity::getPending).sum(),
                capacities.stream().mapToInt(SeatCapacity::getAvailable).sum());

        int threshold = properties.getLedger().getLowSeatThreshold();
        if (summary.getAvailable() == 0) {
            logger.warn("No seats available in group {} across {} teams", groupId, summary.getTeamCount());
        } else if (summary.getAvailable() < threshold) {
            logger.warn("Low seat availability in group {}: {} left (threshold {})",
                    groupId, summary.getAvailable(), threshold);
        }
        return summary;
    }

    /**
     * Available seats per group over healthy teams; ungrouped teams count under {@link #UNGROUPED}.
     */
    public Map<Long, Integer> availableByGroup() {
        Map<Long, Integer> available = new TreeMap<>();
        for (SeatCapacity capacity : listCapacities(null, true)) {
            long group = capacity.getGroupId() == null ? UNGROUPED : capacity.getGroupId();
            available.merge(group, capacity.getAvailable(), Integer::sum);
        }
        return available;
    }

    @CacheEvict(cacheNames = SUMMARY_CACHE, allEntries = true)
    public void evictSummaries() {
        logger.debug("Seat summaries evicted");
    }
}
