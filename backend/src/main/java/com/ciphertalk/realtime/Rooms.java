package com.ciphertalk.realtime;

/** Room naming. */
public final class Rooms {

    private Rooms() {}

    public static String user(String userId) {
        return "user:" + userId;
    }

    public static String chat(String sessionId) {
        return "chat:" + sessionId;
    }

    public static String notifications(String userId) {
        return "notifications:" + userId;
    }
}
