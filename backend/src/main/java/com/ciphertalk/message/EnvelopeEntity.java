package com.ciphertalk.message;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One encrypted direct message. The ciphertext columns are written once by the append batch;
 * afterwards only the status and tombstone columns change, through conditional updates.
 */
@Table("envelopes")
public class EnvelopeEntity {

    @PrimaryKey
    private EnvelopeKey key;

    @Column("sender_id")
    private String senderId;

    @Column("receiver_id")
    private String receiverId;

    /** AES-256-GCM ciphertext of the body, Base64. */
    @Column("encrypted_content")
    private String encryptedContent;

    @Column("iv")
    private String iv;

    @Column("auth_tag")
    private String authTag;

    /** Content key wrapped to the sender's public key, so senders can re-read their history. */
    @Column("sender_wrapped_key")
    private String senderWrappedKey;

    @Column("receiver_wrapped_key")
    private String receiverWrappedKey;

    /** Hex SHA-256 of the plaintext, checked by the reader after decryption. */
    @Column("content_hash")
    private String contentHash;

    @Column("sender_key_version")
    private int senderKeyVersion;

    @Column("receiver_key_version")
    private int receiverKeyVersion;

    @Column("message_type")
    private MessageType messageType;

    @Column("file_metadata")
    private FileMetadata fileMetadata;

    @Column("status")
    private MessageStatus status;

    @Column("sent_at")
    private Instant sentAt;

    @Column("delivered_at")
    private Instant deliveredAt;

    @Column("read_at")
    private Instant readAt;

    @Column("deleted")
    private boolean deleted;

    @Column("deleted_at")
    private Instant deletedAt;

    @Column("reply_to")
    private UUID replyTo;

    public EnvelopeEntity() {}

    public EnvelopeKey getKey() { return key; }
    public void setKey(EnvelopeKey key) { this.key = key; }
    public String getSenderId() { return senderId; }
    public void setSenderId(String senderId) { this.senderId = senderId; }
    public String getReceiverId() { return receiverId; }
    public void setReceiverId(String receiverId) { this.receiverId = receiverId; }
    public String getEncryptedContent() { return encryptedContent; }
    public void setEncryptedContent(String encryptedContent) { this.encryptedContent = encryptedContent; }
    public String getIv() { return iv; }
    public void setIv(String iv) { this.iv = iv; }
    public String getAuthTag() { return authTag; }
    public void setAuthTag(String authTag) { this.authTag = authTag; }
    public String getSenderWrappedKey() { return senderWrappedKey; }
    public void setSenderWrappedKey(String senderWrappedKey) { this.senderWrappedKey = senderWrappedKey; }
    public String getReceiverWrappedKey() { return receiverWrappedKey; }
    public void setReceiverWrappedKey(String receiverWrappedKey) { this.receiverWrappedKey = receiverWrappedKey; }
    public String getContentHash() { return contentHash; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }
    public int getSenderKeyVersion() { return senderKeyVersion; }
    public void setSenderKeyVersion(int senderKeyVersion) { this.senderKeyVersion = senderKeyVersion; }
    public int getReceiverKeyVersion() { return receiverKeyVersion; }
    public void setReceiverKeyVersion(int receiverKeyVersion) { this.receiverKeyVersion = receiverKeyVersion; }
    public MessageType getMessageType() { return messageType; }
    public void setMessageType(MessageType messageType) { this.messageType = messageType; }
    public FileMetadata getFileMetadata() { return fileMetadata; }
    public void setFileMetadata(FileMetadata fileMetadata) { this.fileMetadata = fileMetadata; }
    public MessageStatus getStatus() { return status; }
    public void setStatus(MessageStatus status) { this.status = status; }
    public Instant getSentAt() { return sentAt; }
    public void setSentAt(Instant sentAt) { this.sentAt = sentAt; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public void setDeliveredAt(Instant deliveredAt) { this.deliveredAt = deliveredAt; }
    public Instant getReadAt() { return readAt; }
    public void setReadAt(Instant readAt) { this.readAt = readAt; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
    public UUID getReplyTo() { return replyTo; }
    public void setReplyTo(UUID replyTo) { this.replyTo = replyTo; }

    public boolean isUnreadFor(String userId) {
        return !deleted && status != MessageStatus.READ && userId.equals(receiverId);
    }
}
