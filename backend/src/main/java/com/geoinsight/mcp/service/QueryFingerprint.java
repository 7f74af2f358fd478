package com.geoinsight.mcp.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Content address of a request: sha-256 over the normalized text, the parser identity
 * and the structured-query schema version.
 */
public final class QueryFingerprint {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryFingerprint() {
    }

    /**
     * NFKC, trimmed, inner whitespace collapsed to one space. Case is kept: Korean text has none
     * and region codes are case-sensitive.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC);
        return WHITESPACE.matcher(nfkc.trim()).replaceAll(" ");
    }

    public static String fingerprint(String text, String parserModel, String templateHash, String schemaVersion) {
        String material = normalize(text) + "\u0000" + parserModel + ":" + templateHash + "\u0000" + schemaVersion;
        return sha256(material);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
