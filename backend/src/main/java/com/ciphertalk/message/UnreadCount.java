package com.ciphertalk.message;

public record UnreadCount(long unreadCount) {}
