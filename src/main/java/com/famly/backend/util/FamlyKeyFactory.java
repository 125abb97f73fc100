package com.famly.backend.util;

import com.famly.backend.exception.InvalidKeyException;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the FamlyTable single-table design.
 * Every id that becomes part of a key is validated as a UUID first.
 */
public final class FamlyKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String THREAD_PREFIX = "THREAD";
    public static final String POST_PREFIX = "POST";
    public static final String USER_PREFIX = "USER";
    public static final String AUTHOR_PREFIX = "AUTHOR";
    public static final String PROFILE_PREFIX = "PROFILE";
    public static final String SESSION_PREFIX = "SESSION";
    public static final String METADATA_SUFFIX = "METADATA";

    private FamlyKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws InvalidKeyException if the id is blank or not a UUID
     */
    public static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    public static String getThreadPk(String threadId) {
        validateId(threadId, "Thread");
        return THREAD_PREFIX + DELIMITER + threadId;
    }

    public static String getPostPk(String postId) {
        validateId(postId, "Post");
        return POST_PREFIX + DELIMITER + postId;
    }

    public static String getUserPk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getSessionPk(String sessionId) {
        validateId(sessionId, "Session");
        return SESSION_PREFIX + DELIMITER + sessionId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    /**
     * Question keys are free-form slugs, not UUIDs.
     */
    public static String getProfileSk(String questionKey) {
        if (questionKey == null || questionKey.isBlank()) {
            throw new InvalidKeyException("Question key cannot be null or empty");
        }
        return PROFILE_PREFIX + DELIMITER + questionKey;
    }

    public static String getAuthorGsi1Pk(String userId) {
        validateId(userId, "Author");
        return AUTHOR_PREFIX + DELIMITER + userId;
    }

    // Zero-padded so lexical order matches time order
    public static String getPostGsi1Sk(Instant createdAt) {
        return POST_PREFIX + DELIMITER + String.format("%013d", createdAt.toEpochMilli());
    }

    public static boolean isMetadata(String sk) {
        return METADATA_SUFFIX.equals(sk);
    }

    public static boolean isProfileRecord(String sk) {
        return sk != null && sk.startsWith(PROFILE_PREFIX + DELIMITER);
    }
}
