package com.telemetrysentinel.core.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the grouping key of an error from its message, service and module.
 *
 * <p>
 * The fingerprint is the hex MD5 digest of
 * {@code message + ":" + service + ":" + module}. Stack traces and line
 * numbers are deliberately left out so that occurrences of the same fault
 * raised from slightly different call sites still group together. MD5 is
 * used for grouping only, never for anything security related.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fingerprinter {

    private static final String ALGORITHM = "MD5";
    private static final char DELIMITER = ':';

    private Fingerprinter() {
        // utility class, not instantiable
    }

    /**
     * @param message error message; {@code null} is treated as empty
     * @param service service name; {@code null} is treated as empty
     * @param module  module name; {@code null} is treated as empty
     * @return 32-character lower-case hex fingerprint
     */
    public static String fingerprint(String message, String service, String module) {
        String material = nullToEmpty(message) + DELIMITER + nullToEmpty(service) + DELIMITER
                + nullToEmpty(module);
        return HexFormat.of().formatHex(digest().digest(material.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
