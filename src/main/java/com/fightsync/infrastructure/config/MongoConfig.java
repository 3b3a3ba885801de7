package com.fightsync.infrastructure.config;

import com.fightsync.domain.ports.CatalogStore;
import com.fightsync.domain.ports.ScrapeRunRepository;
import com.fightsync.infrastructure.persistence.MongoCatalogStore;
import com.fightsync.infrastructure.persistence.MongoScrapeRunRepository;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB configuration.
 */
@Configuration
public class MongoConfig {

    @Value("${mongodb.uri:mongodb://localhost:27017/?replicaSet=rs0&connectTimeoutMS=5000&serverSelectionTimeoutMS=5000}")
    private String mongoUri;

    @Value("${mongodb.database:fightsync}")
    private String database;

    @Bean
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .build();
        return MongoClients.create(settings);
    }

    @Bean
    public CatalogStore catalogStore(MongoClient mongoClient, ReconcilerProperties properties) {
        return new MongoCatalogStore(mongoClient, database,
            properties.getFighterBatchSize(), properties.getFighterBatchPauseMs());
    }

    @Bean
    public ScrapeRunRepository scrapeRunRepository(MongoClient mongoClient, ReconcilerProperties properties) {
        return new MongoScrapeRunRepository(mongoClient, database, properties.getRunRetentionDays());
    }
}
