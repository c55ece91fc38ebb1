package com.ciphertalk.message;

public record OpenSessionRequest(String counterpartId) {}
