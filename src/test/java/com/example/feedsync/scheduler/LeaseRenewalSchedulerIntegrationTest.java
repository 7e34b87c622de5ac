package com.example.feedsync.scheduler;

import com.example.feedsync.exception.HubSubscriptionException;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.support.IntegrationTestBase;
import com.example.feedsync.webhook.WebhookVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.example.feedsync.support.FeedFixtures.ANI;
import static com.example.feedsync.support.FeedFixtures.BLOOMBERG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LeaseRenewalScheduler Integration Tests")
class LeaseRenewalSchedulerIntegrationTest extends IntegrationTestBase {

    private static final long LEASE_SECONDS = 864000;

    @Autowired
    private LeaseRenewalScheduler scheduler;

    @Autowired
    private WebhookVerifier verifier;

    private static org.mockito.ArgumentMatcher<ChannelSubscription> channel(String channelId) {
        return subscription -> subscription != null && channelId.equals(subscription.getChannelId());
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Should subscribe pending channels on the first tick")
        void shouldSubscribePendingChannels() {
            int issued = scheduler.runRenewalCycle();

            assertThat(issued).isEqualTo(2);
            verify(hubClient).subscribe(argThat(channel(BLOOMBERG)), eq(LEASE_SECONDS));
            verify(hubClient).subscribe(argThat(channel(ANI)), eq(LEASE_SECONDS));
            assertThat(registry.get(BLOOMBERG).orElseThrow().getState()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(registry.get(BLOOMBERG).orElseThrow().getLeaseExpiresAt())
                    .isEqualTo(clock.instant().plusSeconds(LEASE_SECONDS));
        }

        @Test
        @DisplayName("Should renew a lease that ends inside the renewal margin")
        void shouldRenewLeaseInsideMargin() {
            // Given a lease ending in 30 seconds with a 60 second margin
            registry.markActive(BLOOMBERG, 30);
            registry.markActive(ANI, 3600);

            // When
            int issued = scheduler.runRenewalCycle();

            // Then
            assertThat(issued).isEqualTo(1);
            verify(hubClient).subscribe(argThat(channel(BLOOMBERG)), eq(LEASE_SECONDS));
            verify(hubClient, never()).subscribe(argThat(channel(ANI)), anyLong());
            assertThat(registry.get(BLOOMBERG).orElseThrow().getLeaseExpiresAt())
                    .isEqualTo(clock.instant().plusSeconds(LEASE_SECONDS));
        }

        @Test
        @DisplayName("Should skip unsubscribed channels")
        void shouldSkipUnsubscribed() {
            registry.unsubscribe(BLOOMBERG);
            registry.unsubscribe(ANI);

            assertThat(scheduler.runRenewalCycle()).isZero();
            verifyNoInteractions(hubClient);
        }
    }

    @Nested
    @DisplayName("Lease confirmation")
    class LeaseConfirmation {

        private static final long GRANTED_SECONDS = 432000;

        @Test
        @DisplayName("Should keep the lease granted by a handshake that arrives before the hub replies")
        void shouldKeepHandshakeLeaseConfirmedBeforeReply() {
            // Given a hub that verifies synchronously with a shorter lease than requested
            registry.markActive(ANI, 86400);
            doAnswer(invocation -> {
                ChannelSubscription requested = invocation.getArgument(0);
                verifier.handshake("subscribe", requested.getTopicUrl(), "c", GRANTED_SECONDS);
                return null;
            }).when(hubClient).subscribe(argThat(channel(BLOOMBERG)), anyLong());

            // When
            int issued = scheduler.runRenewalCycle();

            // Then
            ChannelSubscription active = registry.get(BLOOMBERG).orElseThrow();
            assertThat(issued).isEqualTo(1);
            assertThat(active.getState()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(active.getLeaseExpiresAt()).isEqualTo(clock.instant().plusSeconds(GRANTED_SECONDS));
        }

        @Test
        @DisplayName("Should replace the requested lease when the handshake arrives after the hub replies")
        void shouldApplyHandshakeLeaseAfterReply() {
            registry.markActive(ANI, 86400);
            scheduler.runRenewalCycle();
            assertThat(registry.get(BLOOMBERG).orElseThrow().getLeaseExpiresAt())
                    .isEqualTo(clock.instant().plusSeconds(LEASE_SECONDS));

            clock.advance(Duration.ofSeconds(5));
            verifier.handshake("subscribe", registry.get(BLOOMBERG).orElseThrow().getTopicUrl(), "c", GRANTED_SECONDS);

            assertThat(registry.get(BLOOMBERG).orElseThrow().getLeaseExpiresAt())
                    .isEqualTo(clock.instant().plusSeconds(GRANTED_SECONDS));
        }

        @Test
        @DisplayName("Should renew again within the margin of the granted lease")
        void shouldRenewAgainWithinGrantedLeaseMargin() {
            registry.markActive(ANI, 3_000_000);
            doAnswer(invocation -> {
                ChannelSubscription requested = invocation.getArgument(0);
                verifier.handshake("subscribe", requested.getTopicUrl(), "c", GRANTED_SECONDS);
                return null;
            }).when(hubClient).subscribe(argThat(channel(BLOOMBERG)), anyLong());
            scheduler.runRenewalCycle();

            clock.advance(Duration.ofSeconds(GRANTED_SECONDS - 30));

            assertThat(scheduler.runRenewalCycle()).isEqualTo(1);
            verify(hubClient, times(2)).subscribe(argThat(channel(BLOOMBERG)), anyLong());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should mark a channel failed after three consecutive hub failures")
        void shouldFailAfterThreeAttempts() {
            // Given a lease inside the margin and a hub that keeps failing for it
            registry.markActive(BLOOMBERG, 30);
            registry.markActive(ANI, 3600);
            doThrow(new HubSubscriptionException("Hub answered 500"))
                    .when(hubClient).subscribe(argThat(channel(BLOOMBERG)), anyLong());

            // When: first attempt, then one per backoff window
            scheduler.runRenewalCycle();
            assertThat(registry.get(BLOOMBERG).orElseThrow().getState()).isEqualTo(SubscriptionState.EXPIRING);
            assertThat(scheduler.runRenewalCycle()).as("backoff not yet elapsed").isZero();

            clock.advance(Duration.ofSeconds(1));
            scheduler.runRenewalCycle();
            clock.advance(Duration.ofSeconds(2));
            scheduler.runRenewalCycle();

            // Then
            ChannelSubscription failed = registry.get(BLOOMBERG).orElseThrow();
            assertThat(failed.getState()).isEqualTo(SubscriptionState.FAILED);
            assertThat(failed.getRenewalAttempts()).isEqualTo(3);
            assertThat(failed.getStateReason()).contains("500");
            verify(hubClient, times(3)).subscribe(argThat(channel(BLOOMBERG)), anyLong());
            assertThat(registry.get(ANI).orElseThrow().getState()).isEqualTo(SubscriptionState.ACTIVE);
        }

        @Test
        @DisplayName("Should retry a failed channel with a fresh cycle after the cool-down")
        void shouldRetryAfterCooldown() {
            registry.markActive(ANI, 86400);
            registry.markFailed(BLOOMBERG, "Denied by hub");

            assertThat(scheduler.runRenewalCycle()).isZero();

            clock.advance(Duration.ofHours(1));
            assertThat(scheduler.runRenewalCycle()).isEqualTo(1);
            ChannelSubscription recovered = registry.get(BLOOMBERG).orElseThrow();
            assertThat(recovered.getState()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(recovered.getRenewalAttempts()).isZero();
        }
    }

    @Test
    @DisplayName("Should not issue a second renewal while one is in flight")
    void shouldNotDuplicateInFlightRenewal() throws Exception {
        // Given a hub call for Bloomberg that blocks until released
        registry.markActive(ANI, 3600);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(hubClient).subscribe(argThat(channel(BLOOMBERG)), anyLong());

        Thread tick = new Thread(scheduler::runRenewalCycle);
        tick.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        int secondTick = scheduler.runRenewalCycle();
        boolean manual = scheduler.renewNow(BLOOMBERG);
        release.countDown();
        tick.join(5000);

        // Then
        assertThat(secondTick).isZero();
        assertThat(manual).isFalse();
        verify(hubClient, times(1)).subscribe(any(), anyLong());
        assertThat(scheduler.isInFlight(BLOOMBERG)).isFalse();
    }

    @Test
    @DisplayName("Should unsubscribe locally even when the hub request fails")
    void shouldUnsubscribeDespiteHubFailure() {
        doThrow(new HubSubscriptionException("Hub answered 503")).when(hubClient).unsubscribe(any());

        ChannelSubscription result = scheduler.unsubscribe(BLOOMBERG);

        assertThat(result.getState()).isEqualTo(SubscriptionState.UNSUBSCRIBED);
        verify(hubClient).unsubscribe(argThat(channel(BLOOMBERG)));
    }
}
