package com.ciphertalk.account;

import java.time.Instant;
import java.util.Set;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * Directory record for a chat user. The username doubles as the user id used across
 * sessions, envelopes and presence. Key material lives in {@code user_keys}, not here.
 */
@Table("accounts")
public class UserAccount {

    @PrimaryKey
    public String username;

    /** SHA-256(password) computed by the client; the raw password never reaches the server. */
    @Column("login_hash")
    public String loginHash;

    @Column("display_name")
    public String displayName;

    /** Friend ids used for presence fan-out. Maintained by the social graph, read-only here. */
    @Column("friends")
    public Set<String> friends;

    /** Written when the user's last real-time connection goes away. */
    @Column("last_seen_at")
    public Instant lastSeenAt;

    @Column("created_at")
    public long createdAt;
}
