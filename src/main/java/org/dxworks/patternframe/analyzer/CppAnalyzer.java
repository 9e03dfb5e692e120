package org.dxworks.patternframe.analyzer;

import org.dxworks.patternframe.Language;
import org.dxworks.patternframe.PatternframeConfig;
import org.dxworks.patternframe.analyzer.cpp.ExtractionContext;
import org.dxworks.patternframe.analyzer.cpp.PatternWalker;
import org.dxworks.patternframe.analyzer.cpp.ResultCollector;
import org.dxworks.patternframe.model.FileAnalysis;
import org.dxworks.patternframe.syntax.SourceText;
import org.dxworks.patternframe.syntax.SyntaxNode;

/**
 * Extracts {@code <<} message patterns, accumulator values, comments and free literals from one
 * C/C++ unit. Stateless; every call runs with a fresh {@link ExtractionContext}.
 */
public class CppAnalyzer implements LanguageAnalyzer {
    private final PatternframeConfig config;

    public CppAnalyzer(PatternframeConfig config) {
        this.config = config;
    }

    @Override
    public FileAnalysis analyze(String filePath, String sourceCode, SyntaxNode rootNode) {
        ExtractionContext context = new ExtractionContext(config, new SourceText(sourceCode));
        new PatternWalker(context).run(rootNode);

        ResultCollector results = context.getResults();
        FileAnalysis analysis = new FileAnalysis();
        analysis.filePath = filePath;
        analysis.language = Language.CPP.getName();
        analysis.patterns = results.getPatterns();
        analysis.accumulators = results.getAccumulators();
        analysis.comments = results.getComments();
        analysis.literals = results.getLiterals();
        analysis.errors.addAll(context.getErrors());
        return analysis;
    }
}
