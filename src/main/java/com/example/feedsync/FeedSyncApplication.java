package com.example.feedsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point. Scheduling is enabled so lease renewal, backfill and
 * statistics reporting run on their own cadence next to the webhook endpoints.
 */
@SpringBootApplication
@EnableScheduling // allows methods annotated with @Scheduled to run
@ConfigurationPropertiesScan
public class FeedSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedSyncApplication.class, args);
    }
}
