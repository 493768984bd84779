package com.sitebuild.groupby.config;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed INI file: ordered sections of ordered options. Problems found while
 * parsing are kept in {@link #getErrors()} instead of failing the whole file.
 */
public class IniDocument {

    @Getter
    private final String filename;
    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    @Getter
    private final List<String> errors = new ArrayList<>();

    public IniDocument(String filename) {
        this.filename = filename;
    }

    void put(String section, String key, String value) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(key, value);
    }

    void addSection(String section) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>());
    }

    void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Set<String> sections() {
        return Collections.unmodifiableSet(sections.keySet());
    }

    public Map<String, String> sectionAsMap(String section) {
        Map<String, String> values = sections.get(section);
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    /**
     * Lookup by dotted key: {@code "tags.pagination.enabled"} matches option
     * {@code pagination.enabled} in {@code [tags]} as well as option
     * {@code enabled} in {@code [tags.pagination]}.
     */
    public Optional<String> get(String dottedKey) {
        int dot = dottedKey.indexOf('.');
        while (dot > 0) {
            String section = dottedKey.substring(0, dot);
            String option = dottedKey.substring(dot + 1);
            Map<String, String> values = sections.get(section);
            if (values != null && values.containsKey(option)) {
                return Optional.ofNullable(values.get(option));
            }
            dot = dottedKey.indexOf('.', dot + 1);
        }
        return Optional.empty();
    }
}
