/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.util;

/**
 * Dot-delimited subject handling.
 *
 * <pre>
 *   ORDERS.new   exact subject "new" of stream ORDERS
 *   ORDERS.*     every direct child of ORDERS (ORDERS.new, not ORDERS.new.error)
 *   ORDERS.&gt;     every descendant of ORDERS at any depth
 * </pre>
 *
 * The first token always names the stream.
 */
public final class Subjects {

    public static final String SINGLE_WILDCARD = "*";
    public static final String FULL_WILDCARD = ">";

    private Subjects() {}

    /**
     * Validates a subscription subject. Wildcards must occupy a whole token,
     * {@code >} may only be the last token and the stream token may not be a wildcard.
     *
     * @return a description of the problem, or {@code null} if the subject is valid
     */
    public static String validateFilter(String subject) {
        if (subject == null || subject.isBlank()) return "subject must not be blank";
        String[] tokens = subject.split("\\.", -1);
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty()) return "subject '" + subject + "' contains an empty token";
            if (token.chars().anyMatch(Character::isWhitespace)) {
                return "subject '" + subject + "' contains whitespace";
            }
            boolean wildcard = SINGLE_WILDCARD.equals(token) || FULL_WILDCARD.equals(token);
            if (!wildcard && (token.contains(SINGLE_WILDCARD) || token.contains(FULL_WILDCARD))) {
                return "wildcard must be a whole token in '" + subject + "'";
            }
            if (i == 0 && wildcard) return "stream token of '" + subject + "' must not be a wildcard";
            if (FULL_WILDCARD.equals(token) && i != tokens.length - 1) {
                return "'>' must be the last token in '" + subject + "'";
            }
        }
        return null;
    }

    /** A subject that messages are published to: valid and free of wildcards. */
    public static boolean isLiteral(String subject) {
        return validateFilter(subject) == null
                && !subject.contains(SINGLE_WILDCARD) && !subject.contains(FULL_WILDCARD);
    }

    /** The stream a subject belongs to: its first dot-delimited token. */
    public static String streamName(String subject) {
        if (subject == null) return null;
        int dot = subject.indexOf('.');
        return dot < 0 ? subject : subject.substring(0, dot);
    }

    /** The catch-all subject of a stream, e.g. {@code ORDERS.>}. */
    public static String allOf(String streamName) {
        return streamName + "." + FULL_WILDCARD;
    }

    /** Whether a literal subject is matched by a filter that may contain wildcards. */
    public static boolean matches(String filter, String subject) {
        String[] f = filter.split("\\.");
        String[] s = subject.split("\\.");
        for (int i = 0; i < f.length; i++) {
            if (FULL_WILDCARD.equals(f[i])) return s.length > i;
            if (i >= s.length) return false;
            if (!SINGLE_WILDCARD.equals(f[i]) && !f[i].equals(s[i])) return false;
        }
        return f.length == s.length;
    }
}
