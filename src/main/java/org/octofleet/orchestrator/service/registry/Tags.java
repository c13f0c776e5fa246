package org.octofleet.orchestrator.service.registry;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Node tags are stored as one lower-case CSV column. */
public final class Tags {
    private Tags() {}

    public static String toCsv(Collection<String> tags) {
        if (tags == null) return "";
        var normalized = tags.stream()
                .map(t -> t == null ? "" : t.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isBlank())
                .collect(Collectors.toCollection(LinkedHashSet::new)); // keeps order, de-duplicates
        return String.join(",", normalized);
    }

    public static List<String> fromCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
