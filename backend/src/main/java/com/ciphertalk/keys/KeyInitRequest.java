package com.ciphertalk.keys;

/**
 * Body of {@code POST /api/keys/init}. {@code rotate} must be set to replace an existing key;
 * the previous versions stay readable.
 */
public record KeyInitRequest(String passphrase, boolean rotate) {}
