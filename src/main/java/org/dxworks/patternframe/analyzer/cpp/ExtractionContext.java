package org.dxworks.patternframe.analyzer.cpp;

import org.dxworks.patternframe.PatternframeConfig;
import org.dxworks.patternframe.model.ExtractionError;
import org.dxworks.patternframe.syntax.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * All mutable state of one extraction run. Never shared between units, so units can be
 * processed in parallel.
 */
public class ExtractionContext {
    private final PatternframeConfig config;
    private final SourceText source;
    private final DuplicateGuard guard;
    private final LiteralNormalizer normalizer;
    private final ChainProcessor chains;
    private final AccumulatorTracker accumulators;
    private final ResultCollector results;
    private final List<ExtractionError> errors = new ArrayList<>();

    public ExtractionContext(PatternframeConfig config, SourceText source) {
        this.config = config;
        this.source = source;
        this.guard = new DuplicateGuard(source,
                config.getDuplicateGuardCapacity(), config.getDuplicateGuardFalsePositiveRate());
        this.normalizer = new LiteralNormalizer(source, guard);
        OperandClassifier classifier = new OperandClassifier(source, normalizer, guard,
                config.getTerminatorIdentifiers());
        this.accumulators = new AccumulatorTracker(source,
                config.getAccumulatorTypes(), config.getUnresolvedAccumulatorPolicy());
        this.chains = new ChainProcessor(source, classifier, accumulators,
                config.getBuilderStartCalls(), config.getOutputSinks());
        this.results = new ResultCollector(config.getMinWords(), config.getMinPatternWords());
    }

    public PatternframeConfig getConfig() {
        return config;
    }

    public SourceText getSource() {
        return source;
    }

    public DuplicateGuard getGuard() {
        return guard;
    }

    public LiteralNormalizer getNormalizer() {
        return normalizer;
    }

    public ChainProcessor getChains() {
        return chains;
    }

    public AccumulatorTracker getAccumulators() {
        return accumulators;
    }

    public ResultCollector getResults() {
        return results;
    }

    public List<ExtractionError> getErrors() {
        return errors;
    }

    public void recordError(ExtractionError error) {
        errors.add(error);
    }

    public void trace(String message) {
        if (config.isVerbose()) {
            System.out.println("[patternframe] " + message);
        }
    }
}
