package com.ciphertalk.presence;

import java.time.Instant;

public record PresenceChange(String userId, boolean online, Instant at) {}
