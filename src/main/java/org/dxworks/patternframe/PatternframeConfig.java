package org.dxworks.patternframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.patternframe.analyzer.cpp.UnresolvedAccumulatorPolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class PatternframeConfig {

    private static final String CONFIG_FILE_NAME = "patternframe-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MIN_WORDS = 3;
    private static final int DEFAULT_MIN_PATTERN_WORDS = 3;
    private static final int DEFAULT_BASELINE_MIN_WORDS = 2;
    private static final int DEFAULT_GUARD_CAPACITY = 100_000;
    private static final double DEFAULT_GUARD_FALSE_POSITIVE_RATE = 0.001;
    private static final List<String> DEFAULT_BUILDER_START_CALLS = List.of("str::stream()", "std::stream()");
    private static final List<String> DEFAULT_OUTPUT_SINKS = List.of("std::cout", "std::cerr", "std::clog", "cout", "cerr", "clog");
    private static final List<String> DEFAULT_TERMINATOR_IDENTIFIERS = List.of("endl", "std::endl");
    private static final List<String> DEFAULT_ACCUMULATOR_TYPES = List.of("StringBuilder");
    private static final List<String> DEFAULT_EXCLUDES = List.of(
            ".git/", ".svn/", ".hg/",
            "node_modules/", "__pycache__/",
            ".vscode/", ".idea/",
            "vendor/", "third_party/", "external/");

    private final int maxFileLines;
    private final int minWords;
    private final int minPatternWords;
    private final int baselineMinWords;
    private final boolean stopOnFirstError;
    private final UnresolvedAccumulatorPolicy unresolvedAccumulatorPolicy;
    private final Set<String> builderStartCalls;
    private final Set<String> outputSinks;
    private final Set<String> terminatorIdentifiers;
    private final Set<String> accumulatorTypes;
    private final int duplicateGuardCapacity;
    private final double duplicateGuardFalsePositiveRate;
    private final List<String> excludes;
    private final boolean verbose;

    private PatternframeConfig(Settings s) {
        this.maxFileLines = positiveOr(s.maxFileLines, DEFAULT_MAX_FILE_LINES);
        this.minWords = positiveOr(s.minWords, DEFAULT_MIN_WORDS);
        this.minPatternWords = positiveOr(s.minPatternWords, DEFAULT_MIN_PATTERN_WORDS);
        this.baselineMinWords = positiveOr(s.baselineMinWords, DEFAULT_BASELINE_MIN_WORDS);
        this.stopOnFirstError = s.stopOnFirstError == null || s.stopOnFirstError;
        this.unresolvedAccumulatorPolicy = UnresolvedAccumulatorPolicy.fromName(s.unresolvedAccumulators);
        this.builderStartCalls = setOr(s.builderStartCalls, DEFAULT_BUILDER_START_CALLS);
        this.outputSinks = setOr(s.outputSinks, DEFAULT_OUTPUT_SINKS);
        this.terminatorIdentifiers = setOr(s.terminatorIdentifiers, DEFAULT_TERMINATOR_IDENTIFIERS);
        this.accumulatorTypes = setOr(s.accumulatorTypes, DEFAULT_ACCUMULATOR_TYPES);
        this.duplicateGuardCapacity = positiveOr(s.duplicateGuardCapacity, DEFAULT_GUARD_CAPACITY);
        this.duplicateGuardFalsePositiveRate =
                (s.duplicateGuardFalsePositiveRate != null
                        && s.duplicateGuardFalsePositiveRate > 0
                        && s.duplicateGuardFalsePositiveRate < 1)
                        ? s.duplicateGuardFalsePositiveRate
                        : DEFAULT_GUARD_FALSE_POSITIVE_RATE;

        Set<String> allExcludes = new LinkedHashSet<>();
        if (s.useDefaultExcludes == null || s.useDefaultExcludes) {
            allExcludes.addAll(DEFAULT_EXCLUDES);
        }
        if (s.excludes != null) {
            allExcludes.addAll(s.excludes);
        }
        this.excludes = List.copyOf(allExcludes);
        this.verbose = s.verbose != null && s.verbose;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMinWords() {
        return minWords;
    }

    public int getMinPatternWords() {
        return minPatternWords;
    }

    public int getBaselineMinWords() {
        return baselineMinWords;
    }

    public boolean isStopOnFirstError() {
        return stopOnFirstError;
    }

    public UnresolvedAccumulatorPolicy getUnresolvedAccumulatorPolicy() {
        return unresolvedAccumulatorPolicy;
    }

    public Set<String> getBuilderStartCalls() {
        return builderStartCalls;
    }

    public Set<String> getOutputSinks() {
        return outputSinks;
    }

    public Set<String> getTerminatorIdentifiers() {
        return terminatorIdentifiers;
    }

    public Set<String> getAccumulatorTypes() {
        return accumulatorTypes;
    }

    public int getDuplicateGuardCapacity() {
        return duplicateGuardCapacity;
    }

    public double getDuplicateGuardFalsePositiveRate() {
        return duplicateGuardFalsePositiveRate;
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public static PatternframeConfig defaults() {
        return new PatternframeConfig(new Settings());
    }

    public static PatternframeConfig from(Settings settings) {
        return new PatternframeConfig(settings == null ? new Settings() : settings);
    }

    public static PatternframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PatternframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            Settings settings = yamlMapper.readValue(configPath.toFile(), Settings.class);
            return from(settings);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Warning: Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    private static int positiveOr(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    private static Set<String> setOr(List<String> values, List<String> fallback) {
        List<String> source = (values == null || values.isEmpty()) ? fallback : values;
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    /**
     * Raw values as they appear in patternframe-config.yml; {@code null} means default.
     */
    public static class Settings {
        public Integer maxFileLines;
        public Integer minWords;
        public Integer minPatternWords;
        public Integer baselineMinWords;
        public Boolean stopOnFirstError;
        public String unresolvedAccumulators;
        public List<String> builderStartCalls;
        public List<String> outputSinks;
        public List<String> terminatorIdentifiers;
        public List<String> accumulatorTypes;
        public Integer duplicateGuardCapacity;
        public Double duplicateGuardFalsePositiveRate;
        public List<String> excludes;
        public Boolean useDefaultExcludes;
        public Boolean verbose;
    }
}
