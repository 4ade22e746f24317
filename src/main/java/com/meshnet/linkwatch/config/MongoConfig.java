package com.meshnet.linkwatch.config;

import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.repository.LinkRepository;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * MongoDB client and repositories, configured from {@code linkwatch.store.*}.
 * Automatic index creation is on so that the unique link index on
 * (topology source, endpoint pair) exists before the first reconciliation.
 */
@Configuration
@RequiredArgsConstructor
@EnableMongoRepositories(basePackageClasses = LinkRepository.class)
public class MongoConfig extends AbstractMongoClientConfiguration {

    private final LinkwatchProperties properties;

    @Override
    protected String getDatabaseName() {
        return properties.getStore().getDatabase();
    }

    @Override
    protected Collection<String> getMappingBasePackages() {
        return List.of(Link.class.getPackageName());
    }

    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Override
    protected void configureClientSettings(MongoClientSettings.Builder builder) {
        LinkwatchProperties.Store store = properties.getStore();
        builder.applyConnectionString(new ConnectionString(store.getUri()))
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(store.getMaxPoolSize())
                        .minSize(store.getMinPoolSize())
                        .maxConnectionIdleTime(store.getMaxConnectionIdleTime().toMillis(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout((int) store.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .readTimeout((int) store.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(store.getServerSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS));
    }
}
