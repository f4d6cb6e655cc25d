package com.keyforge.launcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Keyforge node launcher.
 *
 * Bootstraps identity and root credentials for every configured node before the nodes start.
 * The credential database is opened from the node configuration, not from Spring's datasource.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@ConfigurationPropertiesScan
public class KeyforgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyforgeApplication.class, args);
    }
}
