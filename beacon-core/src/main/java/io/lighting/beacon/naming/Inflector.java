package io.lighting.beacon.naming;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Converts type names into table names.
 * <p>
 * Rules are plain data: irregular word pairs, uncountable words and suffix replacements, loaded
 * from {@code inflections.properties} next to this class. Instances are immutable, so every
 * conversion is a pure function of its input.
 */
public final class Inflector {
    static final String RULES_RESOURCE = "inflections.properties";

    private static final Inflector DEFAULTS = load();

    private final Map<String, String> singularToPlural;
    private final Map<String, String> pluralToSingular;
    private final Set<String> uncountable;
    private final List<SuffixRule> pluralRules;
    private final List<SuffixRule> singularRules;

    private Inflector(Builder builder) {
        this.singularToPlural = Map.copyOf(builder.singularToPlural);
        Map<String, String> reversed = new HashMap<>();
        builder.singularToPlural.forEach((singular, plural) -> reversed.put(plural, singular));
        this.pluralToSingular = Map.copyOf(reversed);
        this.uncountable = Set.copyOf(builder.uncountable);
        this.pluralRules = sorted(builder.pluralRules);
        this.singularRules = sorted(builder.singularRules);
    }

    /**
     * Inflector with the bundled rules.
     */
    public static Inflector defaults() {
        return DEFAULTS;
    }

    /**
     * Builder pre-populated with the bundled rules.
     */
    public static Builder builder() {
        return new Builder().rules(DEFAULTS);
    }

    public String pluralize(String word) {
        Objects.requireNonNull(word, "word");
        if (word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (uncountable.contains(lower) || pluralToSingular.containsKey(lower)) {
            return word;
        }
        String irregular = singularToPlural.get(lower);
        if (irregular != null) {
            return matchCase(word, irregular);
        }
        return applySuffixRules(word, lower, pluralRules, "s");
    }

    public String singularize(String word) {
        Objects.requireNonNull(word, "word");
        if (word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (uncountable.contains(lower) || singularToPlural.containsKey(lower)) {
            return word;
        }
        String irregular = pluralToSingular.get(lower);
        if (irregular != null) {
            return matchCase(word, irregular);
        }
        return applySuffixRules(word, lower, singularRules, "");
    }

    /**
     * Lower-case, underscore separated form of a camel case name: {@code CreatedAt} becomes
     * {@code created_at}, {@code userID} becomes {@code user_id}.
     */
    public String underscore(String name) {
        Objects.requireNonNull(name, "name");
        StringBuilder out = new StringBuilder(name.length() + 4);
        int length = name.length();
        for (int i = 0; i < length; i++) {
            char c = name.charAt(i);
            if (c == '-' || c == ' ' || c == '_') {
                appendSeparator(out);
                continue;
            }
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    char previous = name.charAt(i - 1);
                    boolean nextIsLower = i + 1 < length && Character.isLowerCase(name.charAt(i + 1));
                    if (Character.isLowerCase(previous) || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && nextIsLower)) {
                        appendSeparator(out);
                    }
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '_') {
            end--;
        }
        return out.substring(0, end);
    }

    /**
     * Table name for a type name: underscored, with the last word pluralized.
     * {@code OrderItem} becomes {@code order_items}.
     */
    public String tableize(String typeName) {
        String underscored = underscore(typeName);
        int split = underscored.lastIndexOf('_');
        if (split < 0) {
            return pluralize(underscored);
        }
        return underscored.substring(0, split + 1) + pluralize(underscored.substring(split + 1));
    }

    private static String applySuffixRules(String word, String lower, List<SuffixRule> rules, String fallback) {
        for (SuffixRule rule : rules) {
            if (lower.endsWith(rule.suffix()) && lower.length() > rule.suffix().length()) {
                return word.substring(0, word.length() - rule.suffix().length()) + rule.replacement();
            }
        }
        return word + fallback;
    }

    private static String matchCase(String original, String replacement) {
        if (Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }

    private static void appendSeparator(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != '_') {
            out.append('_');
        }
    }

    private static List<SuffixRule> sorted(Map<String, String> rules) {
        List<SuffixRule> copy = new ArrayList<>();
        rules.forEach((suffix, replacement) -> copy.add(new SuffixRule(suffix, replacement)));
        copy.sort(Comparator.comparingInt((SuffixRule rule) -> rule.suffix().length()).reversed());
        return List.copyOf(copy);
    }

    private static Inflector load() {
        try (InputStream in = Inflector.class.getResourceAsStream(RULES_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing inflection rules: " + RULES_RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                Properties properties = new Properties();
                properties.load(reader);
                return new Builder().properties(properties).build();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load inflection rules", ex);
        }
    }

    private record SuffixRule(String suffix, String replacement) {
    }

    public static final class Builder {
        private final Map<String, String> singularToPlural = new HashMap<>();
        private final Set<String> uncountable = new HashSet<>();
        private final Map<String, String> pluralRules = new LinkedHashMap<>();
        private final Map<String, String> singularRules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder irregular(String singular, String plural) {
            Objects.requireNonNull(singular, "singular");
            Objects.requireNonNull(plural, "plural");
            singularToPlural.put(singular.toLowerCase(Locale.ROOT), plural.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder uncountable(String... words) {
            for (String word : words) {
                uncountable.add(word.trim().toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public Builder pluralRule(String suffix, String replacement) {
            pluralRules.put(suffix.toLowerCase(Locale.ROOT), Objects.requireNonNull(replacement, "replacement"));
            return this;
        }

        public Builder singularRule(String suffix, String replacement) {
            singularRules.put(suffix.toLowerCase(Locale.ROOT), Objects.requireNonNull(replacement, "replacement"));
            return this;
        }

        /**
         * Adds rules in the {@code inflections.properties} format.
         */
        public Builder properties(Properties properties) {
            Objects.requireNonNull(properties, "properties");
            for (String key : properties.stringPropertyNames()) {
                String value = properties.getProperty(key).trim();
                if (key.startsWith("irregular.")) {
                    irregular(key.substring("irregular.".length()), value);
                } else if (key.startsWith("plural.")) {
                    pluralRule(key.substring("plural.".length()), value);
                } else if (key.startsWith("singular.")) {
                    singularRule(key.substring("singular.".length()), value);
                } else if (key.equals("uncountable")) {
                    if (!value.isEmpty()) {
                        uncountable(value.split(","));
                    }
                } else {
                    throw new IllegalArgumentException("Unknown inflection rule: " + key);
                }
            }
            return this;
        }

        private Builder rules(Inflector inflector) {
            singularToPlural.putAll(inflector.singularToPlural);
            uncountable.addAll(inflector.uncountable);
            inflector.pluralRules.forEach(rule -> pluralRules.put(rule.suffix(), rule.replacement()));
            inflector.singularRules.forEach(rule -> singularRules.put(rule.suffix(), rule.replacement()));
            return this;
        }

        public Inflector build() {
            return new Inflector(this);
        }
    }
}
