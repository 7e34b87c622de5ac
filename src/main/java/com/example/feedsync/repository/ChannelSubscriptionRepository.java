package com.example.feedsync.repository;

import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.SubscriptionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChannelSubscriptionRepository extends JpaRepository<ChannelSubscription, String> {

    /**
     * Resolves the subscription a hub callback refers to.
     *
     * @param topicUrl the {@code hub.topic} value
     * @return the matching subscription, if this service owns one
     */
    Optional<ChannelSubscription> findByTopicUrl(String topicUrl);

    long countByState(SubscriptionState state);
}
