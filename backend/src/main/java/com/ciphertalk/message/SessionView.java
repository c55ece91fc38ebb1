package com.ciphertalk.message;

import com.ciphertalk.account.UserProfile;

public record SessionView(String sessionId, UserProfile counterpart, boolean counterpartHasKeys) {}
