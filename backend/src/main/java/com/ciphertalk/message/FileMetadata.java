package com.ciphertalk.message;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.UserDefinedType;

/**
 * Attachment descriptor. The file itself lives encrypted in the attachment store at
 * {@code encryptedPath}; only this pointer travels with the envelope.
 */
@UserDefinedType("file_metadata")
public record FileMetadata(
    @Column("original_name") String originalName,
    @Column("mime_type") String mimeType,
    @Column("size") long size,
    @Column("encrypted_path") String encryptedPath
) {}
