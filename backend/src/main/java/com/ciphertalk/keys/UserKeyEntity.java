package com.ciphertalk.keys;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One version of a user's X25519 keypair. Rows are never updated: a rotation inserts the next
 * version, older rows stay so history encrypted to them can still be opened.
 */
@Table("user_keys")
public class UserKeyEntity {

    @PrimaryKey
    private UserKeyKey key;

    /** X25519 public key (Base64). */
    @Column("public_key")
    private String publicKey;

    /** Private key sealed by {@link PrivateKeySealer}. Opaque to the server. */
    @Column("sealed_private_key")
    private String sealedPrivateKey;

    @Column("fingerprint")
    private String fingerprint;

    @Column("generated_at")
    private Instant generatedAt;

    public UserKeyEntity() {}

    public UserKeyKey getKey() { return key; }
    public void setKey(UserKeyKey key) { this.key = key; }
    public String getPublicKey() { return publicKey; }
    public void setPublicKey(String publicKey) { this.publicKey = publicKey; }
    public String getSealedPrivateKey() { return sealedPrivateKey; }
    public void setSealedPrivateKey(String sealedPrivateKey) { this.sealedPrivateKey = sealedPrivateKey; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public Instant getGeneratedAt() { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }
}
