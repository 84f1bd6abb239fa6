package com.example.boundary.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@ConditionalOnProperty(name = "boundary.audit.store", havingValue = "mongo")
@EnableReactiveMongoRepositories(basePackages = "com.example.boundary.audit.repository")
public class MongoConfig {
    // indexes come from the @Indexed/@CompoundIndex annotations on AuditEntryDoc
}
