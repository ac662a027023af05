package com.bbthechange.teaminvite.config;

import com.bbthechange.teaminvite.model.Team;
import com.bbthechange.teaminvite.util.TeamInviteKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the single seat table with its two GSIs when it does not exist yet.
 * Every item type shares the BaseItem key layout, so any of them describes the table.
 */
@Component
@ConditionalOnExpression("'${team-invite.store:dynamodb}' == 'dynamodb' and ${dynamodb.table.init.enabled:true}")
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        String tableName = TeamInviteKeyFactory.TABLE_NAME;
        DynamoDbTable<Team> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(Team.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                    .provisionedThroughput(throughput())
                    .globalSecondaryIndices(
                            createGSI(TeamInviteKeyFactory.DIRECTORY_INDEX),
                            createGSI(TeamInviteKeyFactory.LOOKUP_INDEX))
                    .build());
            logger.info("Table {} created successfully with GSIs", tableName);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
                .readCapacityUnits(5L)
                .writeCapacityUnits(5L)
                .build();
    }
}
