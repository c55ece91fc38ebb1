package com.ciphertalk.account;

import java.time.Instant;

/** Public profile fields joined into sessions and conversation summaries. */
public record UserProfile(String userId, String displayName, Instant lastSeenAt) {}
