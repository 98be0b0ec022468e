package com.unitutor.courseware.service;

import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content identity of a document: the SHA-256 of its bytes, cut to the first 16 hex characters.
 */
@Component
public class ContentHasher {

    public static final int IDENTITY_LENGTH = 16;
    private static final int CHUNK_SIZE = 4096;

    public String derive(byte[] content) {
        return derive(new ByteArrayInputStream(content));
    }

    public String derive(InputStream source) {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];

        try {
            int read;
            while ((read = source.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document content", e);
        }

        return HexFormat.of().formatHex(digest.digest()).substring(0, IDENTITY_LENGTH);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
