package com.ciphertalk.presence;

public enum PresenceTransition {
    /** The user had no live connection before this one. */
    CAME_ONLINE,
    ALREADY_ONLINE
}
