package com.example.sidelight.grading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An INI-like sidecar: ordered {@code [Section]} blocks of ordered {@code Key=Value} lines.
 */
public class SidecarDocument {

    private final List<Section> sections = new ArrayList<>();

    public Section section(String name) {
        Section section = new Section(name);
        sections.add(section);
        return section;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    public Optional<Section> find(String name) {
        return sections.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    /**
     * Renders the document; sections are separated by one blank line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sections.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            Section section = sections.get(i);
            sb.append('[').append(section.getName()).append("]\n");
            for (Map.Entry<String, String> entry : section.getEntries().entrySet()) {
                sb.append(entry.getKey()).append('=').append(entry.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    public static class Section {

        private final String name;
        private final Map<String, String> entries = new LinkedHashMap<>();

        Section(String name) {
            this.name = name;
        }

        public Section put(String key, String value) {
            entries.put(key, value);
            return this;
        }

        public Section put(String key, int value) {
            return put(key, Integer.toString(value));
        }

        public Section put(String key, boolean value) {
            return put(key, Boolean.toString(value));
        }

        public String getName() {
            return name;
        }

        public Map<String, String> getEntries() {
            return Collections.unmodifiableMap(entries);
        }

        public String get(String key) {
            return entries.get(key);
        }
    }
}
