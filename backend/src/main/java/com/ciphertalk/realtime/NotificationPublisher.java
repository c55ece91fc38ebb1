package com.ciphertalk.realtime;

import com.ciphertalk.realtime.event.ServerEvent;

/** Entry point for dispatchers outside messaging (friend requests, likes) to reach a user. */
public interface NotificationPublisher {

    /** True when at least one live connection received it. */
    boolean notify(String userId, ServerEvent.Notification notification);
}
