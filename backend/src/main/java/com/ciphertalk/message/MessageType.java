package com.ciphertalk.message;

public enum MessageType {
    TEXT, IMAGE, FILE, VOICE, VIDEO
}
