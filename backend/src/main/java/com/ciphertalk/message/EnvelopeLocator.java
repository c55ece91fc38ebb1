package com.ciphertalk.message;

import java.util.UUID;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/** Message id to partition, for operations addressed by id alone. */
@Table("envelope_locator")
public class EnvelopeLocator {

    @PrimaryKey("id")
    private UUID id;

    @Column("session_id")
    private String sessionId;

    public EnvelopeLocator() {}

    public EnvelopeLocator(UUID id, String sessionId) {
        this.id = id;
        this.sessionId = sessionId;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
}
