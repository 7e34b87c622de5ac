package com.example.feedsync.client;

import com.example.feedsync.exception.HubSubscriptionException;
import com.example.feedsync.model.ChannelSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Form-encoded subscribe/unsubscribe requests as defined by the WebSub
 * (PubSubHubbub) protocol. 200, 202 and 204 count as accepted.
 */
@Slf4j
@Component
public class RestHubClient implements HubClient {

    private final RestTemplate restTemplate;
    private final String callbackUrl;
    private final String verifyMode;

    public RestHubClient(@Qualifier("hubRestTemplate") RestTemplate restTemplate,
                         @Value("${app.webhook.base-url}") String baseUrl,
                         @Value("${app.webhook.path:/webhook}") String path,
                         @Value("${app.hub.verify-mode:async}") String verifyMode) {
        this.restTemplate = restTemplate;
        this.callbackUrl = baseUrl + path;
        this.verifyMode = verifyMode;
    }

    @Override
    public void subscribe(ChannelSubscription subscription, long leaseSeconds) {
        MultiValueMap<String, String> form = baseForm(subscription, "subscribe");
        form.add("hub.lease_seconds", Long.toString(leaseSeconds));
        if (subscription.hasSecret()) {
            form.add("hub.secret", subscription.getSecret());
        }
        send(subscription, form);
    }

    @Override
    public void unsubscribe(ChannelSubscription subscription) {
        send(subscription, baseForm(subscription, "unsubscribe"));
    }

    private MultiValueMap<String, String> baseForm(ChannelSubscription subscription, String mode) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hub.callback", callbackUrl);
        form.add("hub.mode", mode);
        form.add("hub.topic", subscription.getTopicUrl());
        form.add("hub.verify", verifyMode);
        return form;
    }

    private void send(ChannelSubscription subscription, MultiValueMap<String, String> form) {
        String mode = form.getFirst("hub.mode");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        log.info("[{}] Channel: {} -> Callback: {}", mode, subscription.getChannelId(), callbackUrl);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    subscription.getHubUrl(), new HttpEntity<>(form, headers), String.class);
            int status = response.getStatusCode().value();
            if (status != 200 && status != 202 && status != 204) {
                throw new HubSubscriptionException("Hub answered " + status + " to " + mode + " for " + subscription.getChannelId());
            }
            log.info("Hub accepted {} for channel {} (HTTP {})", mode, subscription.getChannelId(), status);
        } catch (HttpStatusCodeException ex) {
            log.error("Hub rejected {} for channel {}: {} - {}", mode, subscription.getChannelId(),
                    ex.getStatusCode(), ex.getResponseBodyAsString());
            throw new HubSubscriptionException("Hub answered " + ex.getStatusCode().value() + " to " + mode, ex);
        } catch (RestClientException ex) {
            // covers connect and read timeouts
            log.error("Hub {} request for channel {} failed: {}", mode, subscription.getChannelId(), ex.getMessage());
            throw new HubSubscriptionException("Hub request failed: " + ex.getMessage(), ex);
        }
    }
}
