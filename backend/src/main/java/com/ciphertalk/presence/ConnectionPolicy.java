package com.ciphertalk.presence;

/** How many live connections one user may hold at a time. */
public enum ConnectionPolicy {
    /** Last session wins: a new connection evicts the previous one. */
    SINGLE_CONNECTION,
    MULTI_CONNECTION
}
