package com.example.feedsync.controller;

import com.example.feedsync.exception.MalformedFeedException;
import com.example.feedsync.exception.QueueFullException;
import com.example.feedsync.exception.SignatureVerificationException;
import com.example.feedsync.exception.UnknownTopicException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class WebhookExceptionHandler {

    private final int retryAfterSeconds;

    public WebhookExceptionHandler(@Value("${app.ingestion.retry-after-seconds:30}") int retryAfterSeconds) {
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @ExceptionHandler(SignatureVerificationException.class)
    public ResponseEntity<String> onSignature(SignatureVerificationException ex) {
        return plain(HttpStatus.FORBIDDEN, "Invalid signature");
    }

    @ExceptionHandler(UnknownTopicException.class)
    public ResponseEntity<String> onUnknownTopic(UnknownTopicException ex) {
        return plain(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<String> onQueueFull(QueueFullException ex) {
        log.warn("Backpressure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, Integer.toString(retryAfterSeconds))
                .contentType(MediaType.TEXT_PLAIN)
                .body("Busy, retry later");
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<String> onTaskRejected(TaskRejectedException ex) {
        log.warn("Background work rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, Integer.toString(retryAfterSeconds))
                .contentType(MediaType.TEXT_PLAIN)
                .body("Busy, retry later");
    }

    @ExceptionHandler(MalformedFeedException.class)
    public ResponseEntity<String> onMalformed(MalformedFeedException ex) {
        return plain(HttpStatus.BAD_REQUEST, "Invalid feed body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> onBadRequest(IllegalArgumentException ex) {
        return plain(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private ResponseEntity<String> plain(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
