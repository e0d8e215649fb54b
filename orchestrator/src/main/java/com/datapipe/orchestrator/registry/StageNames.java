package com.datapipe.orchestrator.registry;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Read-time stage name matching.
 *
 * Callers address stages either by display name ("Data Generation") or by
 * an identifier form ("data_generation"). Both resolve to the same stage;
 * stored names are never rewritten.
 */
public final class StageNames {

    private StageNames() {}

    /**
     * Replace underscores with spaces and capitalize each word:
     * "data_generation" → "Data Generation". Acronyms already in upper case
     * are kept ("DBT_transformation" → "DBT Transformation").
     */
    public static String normalize(String raw) {
        if (raw == null) return null;
        return Arrays.stream(raw.trim().replace('_', ' ').split("\\s+"))
                .filter(w -> !w.isEmpty())
                .map(StageNames::capitalize)
                .collect(Collectors.joining(" "));
    }

    /** True when {@code candidate} addresses the stage stored as {@code storedName}. */
    public static boolean matches(String storedName, String candidate) {
        if (storedName == null || candidate == null) return false;
        return storedName.equalsIgnoreCase(candidate.trim())
            || storedName.equalsIgnoreCase(normalize(candidate));
    }

    private static String capitalize(String word) {
        if (word.equals(word.toUpperCase(Locale.ROOT))) {
            return word;
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT)
             + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
