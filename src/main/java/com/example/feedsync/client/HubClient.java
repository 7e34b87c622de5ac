package com.example.feedsync.client;

import com.example.feedsync.model.ChannelSubscription;

/**
 * Outbound subscription requests to the hub.
 */
public interface HubClient {

    /**
     * Asks the hub to start (or renew) delivery for the channel's topic.
     *
     * @throws com.example.feedsync.exception.HubSubscriptionException when the hub does not accept the request
     */
    void subscribe(ChannelSubscription subscription, long leaseSeconds);

    /**
     * @throws com.example.feedsync.exception.HubSubscriptionException when the hub does not accept the request
     */
    void unsubscribe(ChannelSubscription subscription);
}
