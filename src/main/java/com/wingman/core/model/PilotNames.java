package com.wingman.core.model;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name comparison used when the same serial number shows up in several files. Case, accents and
 * spacing never make two names different, and a bare surname matches the full name it ends.
 */
public final class PilotNames {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private PilotNames() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
        String stripped = MARKS.matcher(decomposed).replaceAll("");
        return NON_WORD.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * @return true when both names can belong to the same person
     */
    public static boolean sameIdentity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() || b.isEmpty() || a.equals(b)) {
            return true;
        }
        return a.endsWith(" " + b) || b.endsWith(" " + a);
    }
}
