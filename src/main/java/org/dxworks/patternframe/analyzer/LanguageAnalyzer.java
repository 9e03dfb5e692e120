package org.dxworks.patternframe.analyzer;

import org.dxworks.patternframe.model.Analysis;
import org.dxworks.patternframe.syntax.SyntaxNode;

public interface LanguageAnalyzer {
    Analysis analyze(String filePath, String sourceCode, SyntaxNode rootNode);
}
