package com.decisionswarm.common.consensus;

import java.util.Locale;

/** Canonical form for categorical labels compared across agents. */
final class LabelNormalizer {

    private LabelNormalizer() {}

    /** Trimmed, lower-cased string form; {@code null} when the field is absent or blank. */
    static String normalize(Object raw) {
        if (raw == null) return null;
        String s = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        return s.isEmpty() ? null : s;
    }
}
