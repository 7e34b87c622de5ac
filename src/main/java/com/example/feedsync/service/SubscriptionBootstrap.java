package com.example.feedsync.service;

import com.example.feedsync.config.ChannelProperties;
import com.example.feedsync.config.ChannelProperties.ChannelDefinition;
import com.example.feedsync.registry.SubscriptionRegistry;
import com.example.feedsync.scheduler.LeaseRenewalScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

/**
 * Registers the configured channels once the context is up and, unless
 * disabled, subscribes the pending ones right away instead of waiting for the
 * first renewal tick.
 */
@Slf4j
@Service
public class SubscriptionBootstrap implements ApplicationRunner {

    private final ChannelProperties channelProperties;
    private final SubscriptionRegistry registry;
    private final LeaseRenewalScheduler renewalScheduler;
    private final boolean subscribeOnStartup;

    public SubscriptionBootstrap(ChannelProperties channelProperties,
                                 SubscriptionRegistry registry,
                                 LeaseRenewalScheduler renewalScheduler,
                                 @Value("${app.subscriptions.subscribe-on-startup:true}") boolean subscribeOnStartup) {
        this.channelProperties = channelProperties;
        this.registry = registry;
        this.renewalScheduler = renewalScheduler;
        this.subscribeOnStartup = subscribeOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("🚀 Registering {} configured channel(s)...", channelProperties.channels().size());
        for (ChannelDefinition channel : channelProperties.channels()) {
            try {
                registry.register(channel);
            } catch (RuntimeException ex) {
                log.error("❌ Could not register channel {}: {}", channel.id(), ex.getMessage(), ex);
            }
        }

        if (subscribeOnStartup) {
            int issued = renewalScheduler.runRenewalCycle();
            log.info("✅ Startup subscription cycle issued {} hub request(s)", issued);
        }
    }
}
