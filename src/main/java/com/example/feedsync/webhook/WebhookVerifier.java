package com.example.feedsync.webhook;

import com.example.feedsync.exception.SignatureVerificationException;
import com.example.feedsync.exception.UnknownTopicException;
import com.example.feedsync.model.ChannelSubscription;
import com.example.feedsync.model.PushNotification;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.model.VerificationOutcome;
import com.example.feedsync.registry.SubscriptionRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Authenticates hub traffic: confirms only subscriptions this service asked
 * for, and checks the HMAC signature of every push against the raw body.
 */
@Slf4j
@Service
public class WebhookVerifier {

    private static final Map<String, String> HMAC_ALGORITHMS = Map.of(
            "sha1", "HmacSHA1",
            "sha256", "HmacSHA256",
            "sha384", "HmacSHA384",
            "sha512", "HmacSHA512");

    private final SubscriptionRegistry registry;
    private final boolean signatureRequired;
    private final String globalSecret;

    public WebhookVerifier(SubscriptionRegistry registry,
                           @Value("${app.webhook.signature-required}") boolean signatureRequired,
                           @Value("${app.webhook.secret:}") String globalSecret) {
        this.registry = registry;
        this.signatureRequired = signatureRequired;
        this.globalSecret = globalSecret;
    }

    @PostConstruct
    void announceMode() {
        if (!signatureRequired) {
            log.warn("DEGRADED MODE: push signature verification is DISABLED (app.webhook.signature-required=false). "
                    + "Do not run like this in production.");
        } else if (globalSecret == null || globalSecret.isBlank()) {
            log.warn("No global webhook secret configured; pushes verify only against per-channel secrets");
        }
    }

    /**
     * Answers a hub verification request.
     *
     * @param leaseSeconds lease granted by the hub, or null when not supplied
     * @return the challenge, to be echoed verbatim as the whole response body
     * @throws UnknownTopicException when the mode is neither subscribe nor unsubscribe, or the
     *                               topic is not one this service requested in that mode
     */
    public String handshake(String mode, String topic, String challenge, Long leaseSeconds) {
        if (challenge == null || challenge.isEmpty()) {
            throw new IllegalArgumentException("Missing hub.challenge parameter");
        }
        if (!"subscribe".equalsIgnoreCase(mode) && !"unsubscribe".equalsIgnoreCase(mode)) {
            log.warn("Refusing handshake with mode {} for topic {}", mode, topic);
            throw new UnknownTopicException(topic);
        }
        ChannelSubscription subscription = registry.findByTopic(topic)
                .orElseThrow(() -> {
                    log.warn("Refusing handshake for unknown topic {}", topic);
                    return new UnknownTopicException(topic);
                });

        boolean unsubscribed = subscription.getState() == SubscriptionState.UNSUBSCRIBED;
        if ("unsubscribe".equalsIgnoreCase(mode)) {
            if (!unsubscribed) {
                log.warn("Refusing unsubscribe handshake for channel {} in state {}",
                        subscription.getChannelId(), subscription.getState());
                throw new UnknownTopicException(topic);
            }
            log.info("Confirmed unsubscribe for channel {}", subscription.getChannelId());
            return challenge;
        }

        if (unsubscribed) {
            log.warn("Refusing {} handshake for unsubscribed channel {}", mode, subscription.getChannelId());
            throw new UnknownTopicException(topic);
        }
        if (leaseSeconds != null && leaseSeconds > 0) {
            registry.markActive(subscription.getChannelId(), leaseSeconds);
        }
        log.info("Confirmed {} for channel {} (lease={})", mode, subscription.getChannelId(), leaseSeconds);
        return challenge;
    }

    /**
     * The hub refused or revoked a subscription.
     */
    public void recordDenial(String topic, String reason) {
        ChannelSubscription subscription = registry.findByTopic(topic)
                .orElseThrow(() -> new UnknownTopicException(topic));
        registry.markFailed(subscription.getChannelId(), "Denied by hub: " + (reason != null ? reason : "no reason given"));
    }

    /**
     * Checks the push signature. Makes no state change either way.
     *
     * @throws SignatureVerificationException on a missing, malformed or mismatched signature
     */
    public VerificationOutcome verifyPush(PushNotification notification) {
        if (!signatureRequired) {
            log.debug("Signature check skipped (degraded mode)");
            return VerificationOutcome.SKIPPED;
        }

        String header = notification.signature();
        if (header == null || header.isBlank()) {
            throw new SignatureVerificationException("Missing X-Hub-Signature header");
        }
        int separator = header.indexOf('=');
        if (separator <= 0 || separator == header.length() - 1) {
            throw new SignatureVerificationException("Malformed X-Hub-Signature header");
        }
        String algorithm = HMAC_ALGORITHMS.get(header.substring(0, separator).trim().toLowerCase(Locale.ROOT));
        if (algorithm == null) {
            throw new SignatureVerificationException("Unsupported signature algorithm: " + header.substring(0, separator));
        }

        byte[] supplied;
        try {
            supplied = HexFormat.of().parseHex(header.substring(separator + 1).trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new SignatureVerificationException("Signature digest is not hex", ex);
        }

        String secret = resolveSecret(notification.topicHint());
        if (secret == null || secret.isBlank()) {
            throw new SignatureVerificationException("No secret available to verify push");
        }

        byte[] expected = hmac(algorithm, secret, notification.body());
        if (!MessageDigest.isEqual(expected, supplied)) {
            throw new SignatureVerificationException("Signature mismatch");
        }
        return VerificationOutcome.VERIFIED;
    }

    private String resolveSecret(String topicHint) {
        if (topicHint != null) {
            var subscription = registry.findByTopic(topicHint);
            if (subscription.isPresent() && subscription.get().hasSecret()) {
                return subscription.get().getSecret();
            }
        }
        return globalSecret;
    }

    static byte[] hmac(String algorithm, String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(body);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC unavailable: " + algorithm, ex);
        }
    }
}
