package com.example.feedsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * The fixed set of channels this service tracks, bound from {@code app.channels}.
 */
@ConfigurationProperties(prefix = "app")
public record ChannelProperties(List<ChannelDefinition> channels) {

    public ChannelProperties {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    /**
     * @param id     external channel identifier
     * @param name   display name
     * @param secret optional per-channel hub secret; the global webhook secret is used when blank
     */
    public record ChannelDefinition(String id, String name, String secret) {
    }
}
