package com.bbthechange.teaminvite.repository.impl;

import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.repository.TeamRepository;
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
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.bbthechange.teaminvite.util.TeamInviteKeyFactory.TABLE_NAME;

/**
 * Teams are listed through the DirectoryIndex, whose zero-padded sort key yields ascending ids.
 */
@Repository
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class TeamRepositoryImpl implements TeamRepository {

    private static final Logger logger = LoggerFactory.getLogger(TeamRepositoryImpl.class);

    private final DynamoDbTable<Team> teamTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public TeamRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.teamTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Team.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public List<Team> findAll() {
        return performanceTracker.trackQuery("findAllTeams", TABLE_NAME, () -> {
            QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                    .queryConditional(QueryConditional.keyEqualTo(
                            Key.builder().partitionValue(TeamInviteKeyFactory.TEAM_DIRECTORY).build()))
                    .scanIndexForward(true)
                    .build();

            List<Team> teams = new ArrayList<>();
            teamTable.index(TeamInviteKeyFactory.DIRECTORY_INDEX).query(request)
                    .forEach(page -> teams.addAll(page.items()));
            logger.debug("Found {} teams", teams.size());
            return teams;
        });
    }

    @Override
    public List<Team> findByGroup(Long groupId) {
        if (groupId == null) {
            return findAll();
        }
        return findAll().stream()
                .filter(team -> Objects.equals(groupId, team.getGroupId() == null ? 0L : team.getGroupId()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Team> findById(Long teamId) {
        return performanceTracker.trackQuery("findTeamById", TABLE_NAME, () -> {
            Key key = Key.builder()
                    .partitionValue(TeamInviteKeyFactory.getTeamPk(teamId))
                    .sortValue(TeamInviteKeyFactory.getMetadataSk())
                    .build();
            return Optional.ofNullable(teamTable.getItem(key));
        });
    }

    @Override
    public Team save(Team team) {
        return performanceTracker.trackQuery("saveTeam", TABLE_NAME, () -> {
            team.touch();
            teamTable.putItem(team);
            logger.debug("Saved team {}", team.getTeamId());
            return team;
        });
    }
}
