package com.abcfmt.format;

import com.abcfmt.format.align.AlignmentStrategy;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Formatter settings. {@link #load()} reads {@code abcfmt-defaults.properties} from the
 * classpath and lets system properties ({@code abcfmt.<key>}) and then environment variables
 * ({@code ABCFMT_<KEY>}, upper case with dots as underscores) override individual keys.
 */
public final class FormatterOptions {

    static final String DEFAULTS_RESOURCE = "abcfmt-defaults.properties";
    static final String PROPERTY_PREFIX = "abcfmt.";
    static final String ENV_PREFIX = "ABCFMT_";

    private final boolean align;
    private final AlignmentStrategy strategy;
    private final boolean normalizeRhythms;
    private final boolean sortChordNotes;
    private final boolean expandMultiMeasureRests;
    private final boolean systemComments;
    private final boolean fallbackToUnaligned;

    private FormatterOptions(Builder builder) {
        this.align = builder.align;
        this.strategy = builder.strategy;
        this.normalizeRhythms = builder.normalizeRhythms;
        this.sortChordNotes = builder.sortChordNotes;
        this.expandMultiMeasureRests = builder.expandMultiMeasureRests;
        this.systemComments = builder.systemComments;
        this.fallbackToUnaligned = builder.fallbackToUnaligned;
    }

    public static FormatterOptions defaults() {
        return builder().build();
    }

    public static FormatterOptions load() {
        return load(readDefaults(), System.getProperties(), System.getenv());
    }

    static FormatterOptions load(Properties defaults, Properties system, Map<String, String> env) {
        Builder builder = builder();
        String value;
        if ((value = lookup("align", defaults, system, env)) != null) {
            builder.align(parseBoolean("align", value));
        }
        if ((value = lookup("alignment.strategy", defaults, system, env)) != null) {
            builder.strategy(parseStrategy(value));
        }
        if ((value = lookup("normalizeRhythms", defaults, system, env)) != null) {
            builder.normalizeRhythms(parseBoolean("normalizeRhythms", value));
        }
        if ((value = lookup("sortChordNotes", defaults, system, env)) != null) {
            builder.sortChordNotes(parseBoolean("sortChordNotes", value));
        }
        if ((value = lookup("expandMultiMeasureRests", defaults, system, env)) != null) {
            builder.expandMultiMeasureRests(parseBoolean("expandMultiMeasureRests", value));
        }
        if ((value = lookup("systemComments", defaults, system, env)) != null) {
            builder.systemComments(parseBoolean("systemComments", value));
        }
        if ((value = lookup("fallbackToUnaligned", defaults, system, env)) != null) {
            builder.fallbackToUnaligned(parseBoolean("fallbackToUnaligned", value));
        }
        return builder.build();
    }

    private static Properties readDefaults() {
        Properties properties = new Properties();
        try (InputStream in =
                FormatterOptions.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, ex);
        }
        return properties;
    }

    private static String lookup(
            String key, Properties defaults, Properties system, Map<String, String> env) {
        String value = system.getProperty(PROPERTY_PREFIX + key);
        if (value == null) {
            value = env.get(envName(key));
        }
        if (value == null) {
            value = defaults.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    /** {@code alignment.strategy} becomes {@code ABCFMT_ALIGNMENT_STRATEGY}. */
    static String envName(String key) {
        return ENV_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static boolean parseBoolean(String key, String value) {
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Option " + key + " must be true or false: " + value);
    }

    private static AlignmentStrategy parseStrategy(String value) {
        try {
            return AlignmentStrategy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown alignment strategy: " + value, ex);
        }
    }

    public boolean isAlign() {
        return align;
    }

    public AlignmentStrategy getStrategy() {
        return strategy;
    }

    public boolean isNormalizeRhythms() {
        return normalizeRhythms;
    }

    public boolean isSortChordNotes() {
        return sortChordNotes;
    }

    public boolean isExpandMultiMeasureRests() {
        return expandMultiMeasureRests;
    }

    public boolean isSystemComments() {
        return systemComments;
    }

    public boolean isFallbackToUnaligned() {
        return fallbackToUnaligned;
    }

    public Builder toBuilder() {
        return builder()
                .align(align)
                .strategy(strategy)
                .normalizeRhythms(normalizeRhythms)
                .sortChordNotes(sortChordNotes)
                .expandMultiMeasureRests(expandMultiMeasureRests)
                .systemComments(systemComments)
                .fallbackToUnaligned(fallbackToUnaligned);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "FormatterOptions[align=%s, strategy=%s, normalizeRhythms=%s, sortChordNotes=%s,"
                        + " expandMultiMeasureRests=%s, systemComments=%s, fallbackToUnaligned=%s]",
                align,
                strategy,
                normalizeRhythms,
                sortChordNotes,
                expandMultiMeasureRests,
                systemComments,
                fallbackToUnaligned);
    }

    public static final class Builder {
        private boolean align = true;
        private AlignmentStrategy strategy = AlignmentStrategy.POINTS;
        private boolean normalizeRhythms = true;
        private boolean sortChordNotes = true;
        private boolean expandMultiMeasureRests = true;
        private boolean systemComments;
        private boolean fallbackToUnaligned = true;

        private Builder() {}

        public Builder align(boolean align) {
            this.align = align;
            return this;
        }

        public Builder strategy(AlignmentStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder normalizeRhythms(boolean normalizeRhythms) {
            this.normalizeRhythms = normalizeRhythms;
            return this;
        }

        public Builder sortChordNotes(boolean sortChordNotes) {
            this.sortChordNotes = sortChordNotes;
            return this;
        }

        public Builder expandMultiMeasureRests(boolean expandMultiMeasureRests) {
            this.expandMultiMeasureRests = expandMultiMeasureRests;
            return this;
        }

        public Builder systemComments(boolean systemComments) {
            this.systemComments = systemComments;
            return this;
        }

        public Builder fallbackToUnaligned(boolean fallbackToUnaligned) {
            this.fallbackToUnaligned = fallbackToUnaligned;
            return this;
        }

        public FormatterOptions build() {
            return new FormatterOptions(this);
        }
    }
}
