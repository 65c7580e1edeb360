package com.demo.fit.service;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class UniversityIds {

    private UniversityIds() {}

    /** "UC-Berkeley " -> "uc_berkeley". */
    public static String normalize(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        return s.isEmpty() ? null : s;
    }

    /** Normalized, de-duplicated, order preserved, blanks dropped. */
    public static List<String> normalizeAll(Collection<String> raw) {
        if (raw == null) return List.of();
        var out = new LinkedHashSet<String>();
        raw.stream().map(UniversityIds::normalize).filter(Objects::nonNull).forEach(out::add);
        return List.copyOf(out);
    }
}
