package com.ciphertalk.crypto;

/** Which side of a message a viewer is on; selects the wrapped key they can open. */
public enum Role {
    SENDER,
    RECEIVER
}
