package org.dxworks.patternframe;

import org.dxworks.patternframe.analyzer.cpp.UnresolvedAccumulatorPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PatternframeConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        PatternframeConfig config = PatternframeConfig.defaults();

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(3, config.getMinWords());
        assertEquals(3, config.getMinPatternWords());
        assertEquals(2, config.getBaselineMinWords());
        assertTrue(config.isStopOnFirstError());
        assertEquals(UnresolvedAccumulatorPolicy.STRICT, config.getUnresolvedAccumulatorPolicy());
        assertEquals(Set.of("str::stream()", "std::stream()"), config.getBuilderStartCalls());
        assertEquals(Set.of("std::cout", "std::cerr", "std::clog", "cout", "cerr", "clog"), config.getOutputSinks());
        assertEquals(Set.of("endl", "std::endl"), config.getTerminatorIdentifiers());
        assertEquals(Set.of("StringBuilder"), config.getAccumulatorTypes());
        assertTrue(config.getExcludes().contains(".git/"));
        assertFalse(config.isVerbose());
    }

    @Test
    void missingFileMeansDefaults(@TempDir Path dir) {
        PatternframeConfig config = PatternframeConfig.load(dir.resolve("patternframe-config.yml"));
        assertEquals(3, config.getMinWords());
    }

    @Test
    void yamlOverridesDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("patternframe-config.yml");
        Files.writeString(file, String.join("\n",
                "minWords: 5",
                "minPatternWords: 1",
                "stopOnFirstError: false",
                "unresolvedAccumulators: permissive",
                "accumulatorTypes:",
                "  - StringBuilder",
                "  - StrBuf",
                "excludes:",
                "  - \"**/generated/**\"",
                "useDefaultExcludes: false",
                "somethingUnknown: ignored",
                ""));

        PatternframeConfig config = PatternframeConfig.load(file);

        assertEquals(5, config.getMinWords());
        assertEquals(1, config.getMinPatternWords());
        assertFalse(config.isStopOnFirstError());
        assertEquals(UnresolvedAccumulatorPolicy.PERMISSIVE, config.getUnresolvedAccumulatorPolicy());
        assertEquals(Set.of("StringBuilder", "StrBuf"), config.getAccumulatorTypes());
        assertEquals(List.of("**/generated/**"), config.getExcludes());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        PatternframeConfig.Settings settings = new PatternframeConfig.Settings();
        settings.minWords = 0;
        settings.maxFileLines = -1;
        settings.outputSinks = List.of();
        settings.duplicateGuardFalsePositiveRate = 1.5;

        PatternframeConfig config = PatternframeConfig.from(settings);

        assertEquals(3, config.getMinWords());
        assertEquals(20000, config.getMaxFileLines());
        assertEquals(Set.of("std::cout", "std::cerr", "std::clog", "cout", "cerr", "clog"), config.getOutputSinks());
        assertEquals(0.001, config.getDuplicateGuardFalsePositiveRate());
    }

    @Test
    void unreadableFileMeansDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("patternframe-config.yml");
        Files.writeString(file, "minWords: [not, a, number]\n");

        PatternframeConfig config = PatternframeConfig.load(file);

        assertEquals(3, config.getMinWords());
    }
}
