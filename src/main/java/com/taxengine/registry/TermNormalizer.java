package com.taxengine.registry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes raw extracted terms to the form used for synonym uniqueness and
 * variable keys: lower-case, non-alphanumeric runs collapsed to a single underscore.
 */
public final class TermNormalizer {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TermNormalizer() {
    }

    public static String normalize(String term) {
        if (term == null) {
            return "";
        }
        String collapsed = NON_ALNUM.matcher(term.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '_') {
            start++;
        }
        while (end > start && collapsed.charAt(end - 1) == '_') {
            end--;
        }
        return collapsed.substring(start, end);
    }
}
