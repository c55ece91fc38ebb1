package com.ciphertalk.message;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One side of a conversation: lists a user's sessions without scanning envelopes. Written for
 * both participants when a session is opened and again with every message.
 */
@Table("session_members")
public class SessionMembership {

    @PrimaryKey
    private SessionMembershipKey key;

    @Column("counterpart_id")
    private String counterpartId;

    @Column("updated_at")
    private Instant updatedAt;

    public SessionMembership() {}

    public SessionMembership(String userId, String sessionId, String counterpartId, Instant updatedAt) {
        this.key = new SessionMembershipKey(userId, sessionId);
        this.counterpartId = counterpartId;
        this.updatedAt = updatedAt;
    }

    public SessionMembershipKey getKey() { return key; }
    public void setKey(SessionMembershipKey key) { this.key = key; }
    public String getCounterpartId() { return counterpartId; }
    public void setCounterpartId(String counterpartId) { this.counterpartId = counterpartId; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
