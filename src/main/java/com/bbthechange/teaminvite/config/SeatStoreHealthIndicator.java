package com.bbthechange.teaminvite.config;

import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.IndexStatus;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports the seat table and the two indexes that seat reservation and the waiting queue read from.
 * Down unless the table and both indexes are ACTIVE.
 */
@Component("seatStore")
@ConditionalOnProperty(name = "team-invite.store", havingValue = "dynamodb", matchIfMissing = true)
public class SeatStoreHealthIndicator extends AbstractHealthIndicator {

    static final List<String> REQUIRED_INDEXES =
            List.of(TeamInviteKeyFactory.DIRECTORY_INDEX, TeamInviteKeyFactory.LOOKUP_INDEX);

    private final DynamoDbClient dynamoDbClient;

    public SeatStoreHealthIndicator(DynamoDbClient dynamoDbClient) {
        super("Seat store health check failed");
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        TableDescription table = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(TeamInviteKeyFactory.TABLE_NAME).build()).table();

        builder.withDetail("table", TeamInviteKeyFactory.TABLE_NAME)
                .withDetail("tableStatus", String.valueOf(table.tableStatus()));

        Map<String, IndexStatus> indexes = table.globalSecondaryIndexes().stream()
                .collect(Collectors.toMap(GlobalSecondaryIndexDescription::indexName,
                        GlobalSecondaryIndexDescription::indexStatus));
        boolean indexesActive = true;
        for (String index : REQUIRED_INDEXES) {
            IndexStatus status = indexes.get(index);
            builder.withDetail(index, status == null ? "MISSING" : status.toString());
            indexesActive &= status == IndexStatus.ACTIVE;
        }

        if (table.tableStatus() == TableStatus.ACTIVE && indexesActive) {
            builder.up();
        } else {
            builder.down().withDetail("reason", "Seat table or its indexes not active");
        }
    }
}
