package com.example.feedsync.client;

import com.example.feedsync.exception.ItemNotFoundException;
import com.example.feedsync.exception.ListingRejectedException;
import com.example.feedsync.exception.TransientFetchException;
import com.example.feedsync.model.ItemMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * JSON metadata API client. 404 and other client errors mean the item is not
 * available, or for a listing that the listing was refused; 408, 429, 5xx and
 * transport failures are transient.
 */
@Slf4j
@Component
public class RestMetadataSource implements MetadataSource {

    private final RestTemplate restTemplate;

    public RestMetadataSource(@Qualifier("metadataRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ItemMetadata fetchItem(String itemId) {
        try {
            ItemMetadata metadata = restTemplate.getForObject("/items/{itemId}", ItemMetadata.class, itemId);
            if (metadata == null) {
                throw new ItemNotFoundException(itemId);
            }
            return metadata;
        } catch (HttpStatusCodeException ex) {
            if (isTransient(ex.getStatusCode())) {
                log.warn("Metadata source returned {} for item {}", ex.getStatusCode(), itemId);
                throw new TransientFetchException("Metadata source returned " + ex.getStatusCode().value(), ex);
            }
            log.debug("Item {} unavailable: {}", itemId, ex.getStatusCode());
            throw new ItemNotFoundException(itemId, ex);
        } catch (RestClientException ex) {
            log.warn("Metadata fetch for item {} failed: {}", itemId, ex.getMessage());
            throw new TransientFetchException("Metadata fetch failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<String> listRecentItemIds(String channelId, int limit) {
        log.info("Fetching up to {} item IDs for channel {}", limit, channelId);
        try {
            ResponseEntity<List<String>> response = restTemplate.exchange(
                    "/channels/{channelId}/items?limit={limit}", HttpMethod.GET, null,
                    new ParameterizedTypeReference<>() {}, channelId, limit);
            List<String> ids = response.getBody() != null ? response.getBody() : List.of();
            log.info("Found {} item IDs for channel {}", ids.size(), channelId);
            return ids.size() > limit ? ids.subList(0, limit) : ids;
        } catch (HttpStatusCodeException ex) {
            if (isTransient(ex.getStatusCode())) {
                throw new TransientFetchException("Listing source returned " + ex.getStatusCode().value(), ex);
            }
            log.error("Listing for channel {} rejected: {} - {}", channelId, ex.getStatusCode(), ex.getResponseBodyAsString());
            throw new ListingRejectedException("Listing source rejected channel " + channelId
                    + " with " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new TransientFetchException("Listing failed: " + ex.getMessage(), ex);
        }
    }

    private boolean isTransient(HttpStatusCode status) {
        return status.is5xxServerError() || status.value() == 429 || status.value() == 408;
    }
}
