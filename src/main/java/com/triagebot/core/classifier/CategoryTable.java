package com.triagebot.core.classifier;

import com.triagebot.core.error.TriageConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validated, ordered mapping of category name to keywords.
 * <p>
 * Keywords are stored lower-cased because they are matched against lower-cased text.
 * Category order is preserved and decides the order of scores and labels.
 */
public final class CategoryTable {

    private static final Map<String, List<String>> DEFAULT_CATEGORIES = defaultCategories();

    private final Map<String, List<String>> categories;

    private CategoryTable(Map<String, List<String>> categories) {
        this.categories = categories;
    }

    /**
     * Builds a table from raw configuration.
     *
     * @throws TriageConfigurationException on a blank category name or a null/blank keyword
     */
    public static CategoryTable of(Map<String, List<String>> raw) {
        if (raw == null) {
            throw new TriageConfigurationException("Category table must not be null");
        }
        var validated = new LinkedHashMap<String, List<String>>();
        for (var entry : raw.entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank()) {
                throw new TriageConfigurationException("Category name must not be blank");
            }
            List<String> keywords = entry.getValue() != null ? entry.getValue() : List.of();
            var normalized = new ArrayList<String>(keywords.size());
            for (String keyword : keywords) {
                if (keyword == null || keyword.isBlank()) {
                    throw new TriageConfigurationException("Category '" + name + "' has a blank keyword");
                }
                normalized.add(keyword.toLowerCase(Locale.ROOT));
            }
            validated.put(name, List.copyOf(normalized));
        }
        return new CategoryTable(Collections.unmodifiableMap(validated));
    }

    /**
     * Uses {@code raw} when it has entries, the built-in table otherwise.
     */
    public static CategoryTable ofOrDefaults(Map<String, List<String>> raw) {
        return raw == null || raw.isEmpty() ? defaults() : of(raw);
    }

    public static CategoryTable defaults() {
        return of(DEFAULT_CATEGORIES);
    }

    public Set<String> names() {
        return categories.keySet();
    }

    public List<String> keywords(String category) {
        return categories.getOrDefault(category, List.of());
    }

    public Map<String, List<String>> asMap() {
        return categories;
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    private static Map<String, List<String>> defaultCategories() {
        var table = new LinkedHashMap<String, List<String>>();
        table.put("bug", List.of("error", "crash", "broken", "fail", "exception", "bug"));
        table.put("feature", List.of("feature", "enhancement", "add", "support", "implement"));
        table.put("docs", List.of("documentation", "docs", "readme", "guide", "tutorial"));
        table.put("question", List.of("how", "why", "question", "help", "confused"));
        table.put("performance", List.of("slow", "performance", "lag", "optimize", "speed"));
        table.put("security", List.of("security", "vulnerability", "exploit", "CVE"));
        return Collections.unmodifiableMap(table);
    }
}
