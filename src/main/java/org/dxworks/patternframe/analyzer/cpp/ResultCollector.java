package org.dxworks.patternframe.analyzer.cpp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unique patterns, accumulator values, comments and free literals of one unit. Entries below
 * their word threshold are dropped on the way in.
 */
public class ResultCollector {
    private final int minWords;
    private final int minPatternWords;

    private final Set<String> patterns = new LinkedHashSet<>();
    private final Map<String, String> accumulators = new LinkedHashMap<>();
    private final Set<String> comments = new LinkedHashSet<>();
    private final Set<String> literals = new LinkedHashSet<>();

    public ResultCollector(int minWords, int minPatternWords) {
        this.minWords = minWords;
        this.minPatternWords = minPatternWords;
    }

    public boolean addPattern(String pattern) {
        return LiteralNormalizer.wordCount(pattern) >= minPatternWords && patterns.add(pattern);
    }

    public boolean addComment(String comment) {
        return LiteralNormalizer.wordCount(comment) >= minWords && comments.add(comment);
    }

    public boolean addLiteral(String literal) {
        return LiteralNormalizer.wordCount(literal) >= minWords && literals.add(literal);
    }

    public void addAccumulators(Map<String, String> finalValues) {
        accumulators.putAll(finalValues);
    }

    public List<String> getPatterns() {
        return new ArrayList<>(patterns);
    }

    public Map<String, String> getAccumulators() {
        return new LinkedHashMap<>(accumulators);
    }

    public List<String> getComments() {
        return new ArrayList<>(comments);
    }

    public List<String> getLiterals() {
        return new ArrayList<>(literals);
    }
}
