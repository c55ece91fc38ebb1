package com.ciphertalk.message;

import java.time.Instant;

public record EnvelopeView(
    String id,
    String sessionId,
    String senderId,
    String receiverId,
    String encryptedContent,
    String iv,
    String authTag,
    String senderWrappedKey,
    String receiverWrappedKey,
    String contentHash,
    int senderKeyVersion,
    int receiverKeyVersion,
    MessageType messageType,
    FileMetadata fileMetadata,
    MessageStatus status,
    Instant sentAt,
    Instant deliveredAt,
    Instant readAt,
    String replyTo
) {
    public static EnvelopeView of(EnvelopeEntity entity) {
        return new EnvelopeView(
                entity.getKey().id().toString(),
                entity.getKey().sessionId(),
                entity.getSenderId(),
                entity.getReceiverId(),
                entity.getEncryptedContent(),
                entity.getIv(),
                entity.getAuthTag(),
                entity.getSenderWrappedKey(),
                entity.getReceiverWrappedKey(),
                entity.getContentHash(),
                entity.getSenderKeyVersion(),
                entity.getReceiverKeyVersion(),
                entity.getMessageType(),
                entity.getFileMetadata(),
                entity.getStatus(),
                entity.getSentAt(),
                entity.getDeliveredAt(),
                entity.getReadAt(),
                entity.getReplyTo() != null ? entity.getReplyTo().toString() : null);
    }
}
