package com.travease.auth.config;

import com.travease.auth.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the Users table on startup when it does not exist yet (local development against
 * DynamoDB Local). Deployed environments disable this with {@code dynamodb.table.init.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbTable<User> usersTable;

    public DynamoDBTableInitializer(DynamoDbTable<User> usersTable) {
        this.usersTable = usersTable;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(usersTable);
    }

    <T> void createTableIfNotExists(DynamoDbTable<T> table) {
        String tableName = table.tableName();
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                    .provisionedThroughput(ProvisionedThroughput.builder()
                            .readCapacityUnits(5L)
                            .writeCapacityUnits(5L)
                            .build())
                    .build());
            logger.info("Table {} created successfully", tableName);
        }
    }
}
