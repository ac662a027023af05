package com.bbthechange.teaminvite.config;

import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.IndexStatus;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeatStoreHealthIndicatorTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    private SeatStoreHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new SeatStoreHealthIndicator(dynamoDbClient);
    }

    private void describe(TableStatus tableStatus, GlobalSecondaryIndexDescription... indexes) {
        TableDescription table = TableDescription.builder()
                .tableName(TeamInviteKeyFactory.TABLE_NAME)
                .tableStatus(tableStatus)
                .globalSecondaryIndexes(Arrays.asList(indexes))
                .build();
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
                .thenReturn(DescribeTableResponse.builder().table(table).build());
    }

    private static GlobalSecondaryIndexDescription index(String name, IndexStatus status) {
        return GlobalSecondaryIndexDescription.builder().indexName(name).indexStatus(status).build();
    }

    @Test
    void health_TableAndIndexesActive_Up() {
        // Given
        describe(TableStatus.ACTIVE,
                index(TeamInviteKeyFactory.DIRECTORY_INDEX, IndexStatus.ACTIVE),
                index(TeamInviteKeyFactory.LOOKUP_INDEX, IndexStatus.ACTIVE));

        // When
        Health health = indicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("table", "TeamInviteTable")
            .containsEntry("DirectoryIndex", "ACTIVE")
            .containsEntry("LookupIndex", "ACTIVE");
    }

    @Test
    void health_LookupIndexBackfilling_DownWithReason() {
        // Given
        describe(TableStatus.ACTIVE,
                index(TeamInviteKeyFactory.DIRECTORY_INDEX, IndexStatus.ACTIVE),
                index(TeamInviteKeyFactory.LOOKUP_INDEX, IndexStatus.CREATING));

        // When
        Health health = indicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails())
            .containsEntry("LookupIndex", "CREATING")
            .containsKey("reason");
    }

    @Test
    void health_IndexMissing_Down() {
        // Given
        describe(TableStatus.ACTIVE, index(TeamInviteKeyFactory.DIRECTORY_INDEX, IndexStatus.ACTIVE));

        // When
        Health health = indicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("LookupIndex", "MISSING");
    }

    @Test
    void health_DescribeFails_Down() {
        // Given
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
                .thenThrow(DynamoDbException.builder().message("connection refused").build());

        // When
        Health health = indicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsKey("error");
    }
}
