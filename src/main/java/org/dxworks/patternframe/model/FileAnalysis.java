package org.dxworks.patternframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FileAnalysis implements Analysis {
    public String filePath;
    public String language;
    public List<String> patterns = new ArrayList<>();
    public Map<String, String> accumulators = new LinkedHashMap<>();
    public List<String> comments = new ArrayList<>();
    public List<String> literals = new ArrayList<>();
    public List<ExtractionError> errors = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }

    /**
     * A result with errors is incomplete and must not be used as partially valid.
     */
    @JsonIgnore
    public boolean isComplete() {
        return errors.isEmpty();
    }

    /**
     * Patterns, accumulator values, comments and literals in that order.
     */
    public List<String> allStrings() {
        List<String> all = new ArrayList<>(patterns);
        all.addAll(accumulators.values());
        all.addAll(comments);
        all.addAll(literals);
        return all;
    }
}
