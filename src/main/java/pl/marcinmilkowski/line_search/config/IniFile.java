package pl.marcinmilkowski.line_search.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal section-based INI reader.
 *
 * Section and key names are case-insensitive, keys and values are separated by
 * '=' or ':', and lines starting with '#' or ';' are comments. Entries that
 * appear before the first section header land in the unnamed section "".
 */
public final class IniFile {

    private final Map<String, Map<String, String>> sections;

    private IniFile(Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniFile load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    static IniFile parse(BufferedReader reader) throws IOException {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> current = sections.computeIfAbsent("", k -> new LinkedHashMap<>());

        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                String name = normalize(trimmed.substring(1, trimmed.length() - 1));
                current = sections.computeIfAbsent(name, k -> new LinkedHashMap<>());
                continue;
            }
            int sep = separatorIndex(trimmed);
            if (sep <= 0) {
                continue;
            }
            String key = normalize(trimmed.substring(0, sep));
            String value = trimmed.substring(sep + 1).strip();
            current.put(key, value);
        }
        return new IniFile(sections);
    }

    private static int separatorIndex(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) return colon;
        if (colon < 0) return eq;
        return Math.min(eq, colon);
    }

    private static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    public boolean hasSection(String section) {
        return sections.containsKey(normalize(section));
    }

    public Map<String, String> section(String section) {
        Map<String, String> values = sections.get(normalize(section));
        return values == null ? Collections.emptyMap() : Collections.unmodifiableMap(values);
    }

    public Optional<String> get(String section, String key) {
        return Optional.ofNullable(section(section).get(normalize(key)));
    }

    public int getInt(String section, String key, int fallback) throws ConfigurationException {
        Optional<String> value = get(section, key);
        if (value.isEmpty() || value.get().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + value.get(), e);
        }
    }

    public boolean getBoolean(String section, String key, boolean fallback) throws ConfigurationException {
        Optional<String> value = get(section, key);
        if (value.isEmpty() || value.get().isEmpty()) {
            return fallback;
        }
        return parseBoolean(value.get())
            .orElseThrow(() -> new ConfigurationException("Invalid boolean for '" + key + "': " + value.get()));
    }

    /**
     * Parse the usual INI boolean spellings (true/false, yes/no, on/off, 1/0).
     */
    public static Optional<Boolean> parseBoolean(String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1" -> Optional.of(Boolean.TRUE);
            case "false", "no", "off", "0" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }
}
