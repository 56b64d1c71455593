package com.snapsecret.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC secret store.
 */
@Configuration
@ConditionalOnProperty(name = "snapsecret.store.type", havingValue = "r2dbc", matchIfMissing = true)
public class DatabaseConfig {

    /**
     * Initialize the secrets schema on startup.
     * Executes schema.sql, which only creates missing objects.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(
            ConnectionFactory connectionFactory,
            @Value("${snapsecret.store.initialize-schema:true}") boolean initializeSchema) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
