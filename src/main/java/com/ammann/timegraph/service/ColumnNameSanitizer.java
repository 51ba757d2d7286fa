/* (C)2026 */
package com.ammann.timegraph.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Makes column names safe for symbolic reference: trimmed, unsafe characters removed
 * and collisions resolved with an ascending {@code _n} suffix.
 */
final class ColumnNameSanitizer {

    static final String FALLBACK_NAME = "column";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE = Pattern.compile("[^\\p{L}\\p{N}_]");

    private ColumnNameSanitizer() {}

    /**
     * Sanitizes a single name without collision handling.
     */
    static String clean(String raw) {
        String trimmed = raw == null ? "" : raw.strip();
        String underscored = WHITESPACE.matcher(trimmed).replaceAll("_");
        String safe = UNSAFE.matcher(underscored).replaceAll("");
        return safe.isEmpty() ? FALLBACK_NAME : safe;
    }

    /**
     * Sanitizes all names and de-duplicates them in order of appearance.
     *
     * @param rawNames header names as read
     * @return sanitized unique names, same order and size as {@code rawNames}
     */
    static List<String> sanitize(List<String> rawNames) {
        List<String> result = new ArrayList<>(rawNames.size());
        Set<String> taken = new HashSet<>();

        for (String raw : rawNames) {
            String name = clean(raw);
            if (taken.contains(name)) {
                int counter = 1;
                while (taken.contains(name + "_" + counter)) {
                    counter++;
                }
                name = name + "_" + counter;
            }
            taken.add(name);
            result.add(name);
        }
        return result;
    }
}
