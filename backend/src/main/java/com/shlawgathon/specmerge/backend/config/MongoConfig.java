package com.shlawgathon.specmerge.backend.config;

import com.mongodb.ReadConcern;
import com.mongodb.TransactionOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

import java.time.Clock;

@Configuration
@EnableMongoAuditing
public class MongoConfig {

    /**
     * Transactions read at snapshot concern, so a projection sees both stores at one
     * point in time. Requires a replica set.
     */
    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory mongoDbFactory) {
        return new MongoTransactionManager(mongoDbFactory, TransactionOptions.builder()
                .readConcern(ReadConcern.SNAPSHOT)
                .build());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
