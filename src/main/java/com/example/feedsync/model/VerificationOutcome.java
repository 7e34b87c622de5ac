package com.example.feedsync.model;

public enum VerificationOutcome {
    VERIFIED,
    // signature checking switched off by configuration
    SKIPPED
}
