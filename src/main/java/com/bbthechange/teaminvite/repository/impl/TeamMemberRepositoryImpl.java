package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.model.TeamMember;
import com.bbthechange.teaminvite.repository.TeamMemberRepository;
import com.bbthechange.teaminvite.util.QueryPerformanceTracker;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;

import java.util.ArrayList;
import java.util.List;

import static com.bbthechange.teaminvite.util.TeamInviteKeyFactory.TABLE_NAME;

@Repository
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class TeamMemberRepositoryImpl implements TeamMemberRepository {

    private static final Logger logger = LoggerFactory.getLogger(TeamMemberRepositoryImpl.class);

    private final DynamoDbTable<TeamMember> memberTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public TeamMemberRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.memberTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(TeamMember.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public List<TeamMember> findByTeamId(Long teamId) {
        return performanceTracker.trackQuery("findMembersByTeamId", TABLE_NAME, () -> {
            QueryConditional conditional = QueryConditional.sortBeginsWith(
                    Key.builder()
                            .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                            .sortValue(TeamInviteKeyFactory.MEMBER_PREFIX + "#")
                            .build());

            List<TeamMember> members = new ArrayList<>();
            memberTable.query(QueryEnhancedRequest.builder().queryConditional(conditional).build())
                    .items().forEach(members::add);
            logger.debug("Found {} members for team {}", members.size(), teamId);
            return members;
        });
    }

    @Override
    public TeamMember save(TeamMember member) {
        return performanceTracker.trackQuery("saveTeamMember", TABLE_NAME, () -> {
            member.touch();
            memberTable.putItem(member);
            return member;
        });
    }

    @Override
    public void delete(Long teamId, String identity) {
        performanceTracker.trackWrite("deleteTeamMember", TABLE_NAME, () -> {
            memberTable.deleteItem(Key.builder()
                    .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                    .sortValue(TeamInviteKeyFactory.getMemberSk(identity))
                    .build());
            logger.debug("Removed member {} from team {}", identity, teamId);
        });
    }
}
