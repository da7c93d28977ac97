package com.vertector.nats.consumer;

import java.util.Collection;

/**
 * NATS subject wildcard matching: {@code *} matches exactly one token and a trailing
 * {@code >} matches one or more tokens.
 */
public final class SubjectMatcher {

    private SubjectMatcher() {
    }

    public static boolean matches(String pattern, String subject) {
        if (pattern == null || subject == null) {
            return false;
        }
        String[] p = pattern.split("\\.", -1);
        String[] s = subject.split("\\.", -1);
        for (int i = 0; i < p.length; i++) {
            if (p[i].equals(">")) {
                return i == p.length - 1 && s.length > i;
            }
            if (i >= s.length) {
                return false;
            }
            if (!p[i].equals("*") && !p[i].equals(s[i])) {
                return false;
            }
        }
        return p.length == s.length;
    }

    public static boolean matchesAny(Collection<String> patterns, String subject) {
        for (String pattern : patterns) {
            if (matches(pattern, subject)) {
                return true;
            }
        }
        return false;
    }
}
