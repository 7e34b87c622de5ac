package com.example.feedsync.controller;

import com.example.feedsync.ingestion.FeedParseResult;
import com.example.feedsync.model.PushNotification;
import com.example.feedsync.webhook.PushIngestionService;
import com.example.feedsync.webhook.WebhookVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

/**
 * Hub callback endpoint: GET for subscription verification, POST for content
 * notifications.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookVerifier verifier;
    private final PushIngestionService pushIngestionService;
    private final Clock clock;

    @GetMapping(value = "${app.webhook.path:/webhook}", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verify(@RequestParam("hub.mode") String mode,
                                         @RequestParam("hub.topic") String topic,
                                         @RequestParam(value = "hub.challenge", required = false) String challenge,
                                         @RequestParam(value = "hub.lease_seconds", required = false) Long leaseSeconds,
                                         @RequestParam(value = "hub.reason", required = false) String reason) {
        if ("denied".equalsIgnoreCase(mode)) {
            log.warn("Hub denied subscription for topic {}: {}", topic, reason);
            verifier.recordDenial(topic, reason);
            return ResponseEntity.ok("");
        }
        return ResponseEntity.ok(verifier.handshake(mode, topic, challenge, leaseSeconds));
    }

    @PostMapping("${app.webhook.path:/webhook}")
    public ResponseEntity<Map<String, Object>> receive(@RequestBody(required = false) byte[] body,
                                                       @RequestHeader(value = "X-Hub-Signature", required = false) String signature,
                                                       @RequestHeader(value = "Link", required = false) String link) {
        PushNotification notification = new PushNotification(
                body != null ? body : new byte[0], signature, PushIngestionService.selfTopic(link), clock.instant());
        FeedParseResult result = pushIngestionService.accept(notification);
        return ResponseEntity.accepted().body(Map.of(
                "status", "received",
                "count", result.totalEntries(),
                "queued", result.stubs().size()));
    }
}
