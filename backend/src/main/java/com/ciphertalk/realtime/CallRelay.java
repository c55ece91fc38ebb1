package com.ciphertalk.realtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.ciphertalk.config.CipherTalkProperties;
import com.ciphertalk.error.AuthorizationException;
import com.ciphertalk.error.NotFoundException;
import com.ciphertalk.error.ValidationException;
import com.ciphertalk.realtime.event.ServerEvent;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Call signalling relay. Calls exist only in memory while ringing or active; nothing about a
 * call is persisted. A ring nobody answers ends after the configured timeout with reason
 * {@code timeout} on both sides.
 */
@Component
public class CallRelay {

    private static final Logger log = LoggerFactory.getLogger(CallRelay.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_DISCONNECTED = "disconnected";
    static final String REASON_ENDED = "ended";

    private record Call(String callId, String callerId, String calleeId, String callType, Disposable ringTimer) {

        boolean involves(String userId) {
            return callerId.equals(userId) || calleeId.equals(userId);
        }

        String otherParty(String userId) {
            return callerId.equals(userId) ? calleeId : callerId;
        }
    }

    private final ConcurrentHashMap<String, Call> ringing = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Call> active = new ConcurrentHashMap<>();
    private final UserChannel channel;
    private final Duration ringTimeout;
    private final Scheduler scheduler;

    @Autowired
    public CallRelay(UserChannel channel, CipherTalkProperties properties) {
        this(channel, properties.calls().ringTimeout(), Schedulers.parallel());
    }

    CallRelay(UserChannel channel, Duration ringTimeout, Scheduler scheduler) {
        this.channel = channel;
        this.ringTimeout = ringTimeout;
        this.scheduler = scheduler;
    }

    public void initiate(String callerId, String receiverId, String callType) {
        if (receiverId == null || receiverId.isBlank()) {
            throw new ValidationException("receiverId is required");
        }
        if (receiverId.equals(callerId)) {
            throw new ValidationException("Cannot call yourself");
        }
        String type = callType == null || callType.isBlank() ? "voice" : callType;
        if (!channel.isOnline(receiverId)) {
            channel.deliver(callerId, new ServerEvent.CallFailed(receiverId, "User is offline"));
            return;
        }
        String callId = UUID.randomUUID().toString();
        Disposable timer = Mono.delay(ringTimeout, scheduler).subscribe(tick -> expire(callId));
        ringing.put(callId, new Call(callId, callerId, receiverId, type, timer));

        if (!channel.deliver(receiverId, new ServerEvent.IncomingCall(callId, callerId, type, Instant.now()))) {
            // went offline between the check and the push
            ringing.remove(callId);
            timer.dispose();
            channel.deliver(callerId, new ServerEvent.CallFailed(receiverId, "User is offline"));
            return;
        }
        channel.deliver(callerId, new ServerEvent.CallInitiated(callId, receiverId, type));
        log.debug("Call {} ringing from {} to {}", callId, callerId, receiverId);
    }

    public void accept(String callId, String userId) {
        Call call = claimRinging(callId, userId);
        active.put(callId, call);
        channel.deliver(call.callerId(), new ServerEvent.CallAccepted(callId, userId));
    }

    public void reject(String callId, String userId, String reason) {
        Call call = claimRinging(callId, userId);
        channel.deliver(call.callerId(), new ServerEvent.CallRejected(callId, userId,
                reason == null || reason.isBlank() ? "declined" : reason));
    }

    /** Either party may end; the caller may also cancel while it is still ringing. */
    public void end(String callId, String userId) {
        Call call = active.get(callId);
        Call ring = ringing.get(callId);
        Call target = call != null ? call : ring;
        if (target == null) {
            throw new NotFoundException("No such call: " + callId);
        }
        if (!target.involves(userId)) {
            throw new AuthorizationException("Not a participant of call " + callId);
        }
        if ((call != null && active.remove(callId, call)) || (ring != null && ringing.remove(callId, ring))) {
            target.ringTimer().dispose();
            channel.deliver(target.otherParty(userId), new ServerEvent.CallEnded(callId, userId, REASON_ENDED));
        }
    }

    /** Ends every call the user takes part in; the other party is told the call dropped. */
    public void dropUser(String userId) {
        List<Call> dropped = new ArrayList<>();
        ringing.values().removeIf(call -> call.involves(userId) && dropped.add(call));
        active.values().removeIf(call -> call.involves(userId) && dropped.add(call));
        for (Call call : dropped) {
            call.ringTimer().dispose();
            channel.deliver(call.otherParty(userId), new ServerEvent.CallEnded(call.callId(), null, REASON_DISCONNECTED));
        }
    }

    boolean isRinging(String callId) {
        return ringing.containsKey(callId);
    }

    private void expire(String callId) {
        Call call = ringing.remove(callId);
        if (call == null) {
            return;
        }
        log.debug("Call {} not answered within {}", callId, ringTimeout);
        ServerEvent.CallEnded ended = new ServerEvent.CallEnded(callId, null, REASON_TIMEOUT);
        channel.deliver(call.callerId(), ended);
        channel.deliver(call.calleeId(), ended);
    }

    private Call claimRinging(String callId, String calleeId) {
        Call call = ringing.get(callId);
        if (call == null) {
            throw new NotFoundException("No ringing call: " + callId);
        }
        if (!call.calleeId().equals(calleeId)) {
            throw new AuthorizationException("Only the callee can answer call " + callId);
        }
        if (!ringing.remove(callId, call)) {
            throw new NotFoundException("No ringing call: " + callId);
        }
        call.ringTimer().dispose();
        return call;
    }
}
