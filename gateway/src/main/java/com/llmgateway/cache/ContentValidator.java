package com.llmgateway.cache;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Strong entity tags derived purely from response bytes, so identical
 * payloads get identical tags without any shared state.
 */
public final class ContentValidator {

    private static final String WILDCARD = "*";
    private static final String WEAK_PREFIX = "W/";

    private ContentValidator() {
    }

    /**
     * Quoted hex SHA-256 of the body.
     */
    public static String compute(byte[] body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "\"" + HexFormat.of().formatHex(digest.digest(body)) + "\"";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * True if any If-None-Match value names the current tag. Accepts quoted or
     * bare tags, weak tags, comma-separated lists and the {@code *} wildcard.
     */
    public static boolean matches(String currentTag, List<String> ifNoneMatch) {
        if (currentTag == null || ifNoneMatch == null || ifNoneMatch.isEmpty()) {
            return false;
        }
        String current = normalize(currentTag);
        for (String header : ifNoneMatch) {
            for (String candidate : header.split(",")) {
                String value = candidate.trim();
                if (value.isEmpty()) {
                    continue;
                }
                if (WILDCARD.equals(value) || normalize(value).equals(current)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String normalize(String tag) {
        String value = tag.trim();
        if (value.startsWith(WEAK_PREFIX)) {
            value = value.substring(WEAK_PREFIX.length());
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return value;
    }
}
