package com.ciphertalk.conversation;

import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;

import com.ciphertalk.account.UserDirectory;
import com.ciphertalk.account.UserProfile;
import com.ciphertalk.config.CipherTalkProperties;
import com.ciphertalk.error.ValidationException;
import com.ciphertalk.message.EnvelopeEntity;
import com.ciphertalk.message.EnvelopeView;
import com.ciphertalk.message.MessageStore;
import com.ciphertalk.message.SessionMembership;
import com.ciphertalk.presence.PresenceRegistry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The per-user conversation list, computed at query time.
 *
 * <pre>
 *   sessions of user
 *     → visible envelopes per session (newest first)
 *     → lastMessage = first, unreadCount = addressed to user and not READ
 *     → join counterpart profile + online flag
 *     → sort by lastMessage.sentAt desc, cap at limit
 * </pre>
 * Sessions with no visible message are left out.
 */
@Service
public class ConversationAggregator {

    private static final Comparator<ConversationSummary> MOST_RECENT_FIRST =
            Comparator.comparing((ConversationSummary summary) -> summary.lastMessage().sentAt()).reversed();

    private final MessageStore store;
    private final UserDirectory directory;
    private final PresenceRegistry presence;
    private final CipherTalkProperties.Messages limits;

    public ConversationAggregator(MessageStore store, UserDirectory directory, PresenceRegistry presence,
                                  CipherTalkProperties properties) {
        this.store = store;
        this.directory = directory;
        this.presence = presence;
        this.limits = properties.messages();
    }

    public Flux<ConversationSummary> recentConversations(String userId, Integer limit) {
        int cap = limit != null ? limit : limits.defaultConversationLimit();
        if (cap < 1 || cap > limits.maxPageSize()) {
            return Flux.error(new ValidationException("limit must be between 1 and " + limits.maxPageSize()));
        }
        return store.sessionsOf(userId)
                .flatMap(membership -> summarize(userId, membership))
                .sort(MOST_RECENT_FIRST)
                .take(cap);
    }

    private Mono<ConversationSummary> summarize(String userId, SessionMembership membership) {
        String sessionId = membership.getKey().sessionId();
        String counterpartId = membership.getCounterpartId();
        return store.visibleEnvelopes(sessionId)
                .collectList()
                .filter(envelopes -> !envelopes.isEmpty())
                .flatMap(envelopes -> directory.lookup(counterpartId)
                        .defaultIfEmpty(new UserProfile(counterpartId, counterpartId, null))
                        .map(profile -> new ConversationSummary(
                                sessionId,
                                new ConversationSummary.Counterpart(
                                        profile.userId(),
                                        profile.displayName(),
                                        presence.isOnline(counterpartId),
                                        profile.lastSeenAt()),
                                EnvelopeView.of(envelopes.get(0)),
                                unreadFor(userId, envelopes))));
    }

    private static long unreadFor(String userId, List<EnvelopeEntity> envelopes) {
        return envelopes.stream().filter(entity -> entity.isUnreadFor(userId)).count();
    }
}
