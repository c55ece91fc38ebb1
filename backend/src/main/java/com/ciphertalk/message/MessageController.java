package com.ciphertalk.message;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.ciphertalk.account.CredentialVerifier;
import com.ciphertalk.conversation.ConversationAggregator;
import com.ciphertalk.conversation.ConversationSummary;
import com.ciphertalk.realtime.RealtimeGateway;
import com.ciphertalk.realtime.SendResult;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final MessageStore store;
    private final RealtimeGateway gateway;
    private final ConversationAggregator conversations;
    private final CredentialVerifier credentials;

    public MessageController(MessageStore store, RealtimeGateway gateway,
                             ConversationAggregator conversations, CredentialVerifier credentials) {
        this.store = store;
        this.gateway = gateway;
        this.conversations = conversations;
        this.credentials = credentials;
    }

    @PostMapping("/sessions")
    public Mono<SessionView> openSession(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody OpenSessionRequest request) {
        return credentials.verify(authorization)
                .flatMap(userId -> store.openSession(userId, request.counterpartId()));
    }

    /**
     * Stores an already encrypted message and pushes it if the receiver is online.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<EnvelopeView> sendMessage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody MessageRequest request) {
        return credentials.verify(authorization)
                .flatMap(userId -> gateway.send(userId, request))
                .map(SendResult::envelope);
    }

    @GetMapping("/sessions/{sessionId}")
    public Flux<EnvelopeView> listConversation(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String sessionId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String before) {
        return credentials.verify(authorization)
                .flatMapMany(userId -> store.listConversation(sessionId, userId, limit, before))
                .map(EnvelopeView::of);
    }

    @PostMapping("/sessions/{sessionId}/read")
    public Mono<ReadReceipt> markRead(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String sessionId) {
        return credentials.verify(authorization)
                .flatMap(userId -> gateway.markSessionRead(sessionId, userId));
    }

    @GetMapping("/{messageId}/decryption")
    public Mono<DecryptionMaterial> getDecryptionMaterial(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String messageId) {
        return credentials.verify(authorization)
                .flatMap(userId -> store.decryptionMaterial(messageId, userId));
    }

    @DeleteMapping("/{messageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteMessage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String messageId) {
        return credentials.verify(authorization)
                .flatMap(userId -> gateway.deleteMessage(messageId, userId))
                .then();
    }

    @GetMapping("/conversations/recent")
    public Flux<ConversationSummary> recentConversations(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) Integer limit) {
        return credentials.verify(authorization)
                .flatMapMany(userId -> conversations.recentConversations(userId, limit));
    }

    @GetMapping("/unread/count")
    public Mono<UnreadCount> unreadCount(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return credentials.verify(authorization)
                .flatMap(store::countUnread)
                .map(UnreadCount::new);
    }
}
