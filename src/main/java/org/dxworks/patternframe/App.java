package org.dxworks.patternframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.patternframe.analyzer.CppAnalyzer;
import org.dxworks.patternframe.analyzer.LanguageAnalyzer;
import org.dxworks.patternframe.analyzer.cpp.LiteralNormalizer;
import org.dxworks.patternframe.model.ExtractionError;
import org.dxworks.patternframe.model.FileAnalysis;
import org.dxworks.patternframe.syntax.TreeSitterSyntaxNode;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCpp;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ref.Reference;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final Map<Language, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Language.class);

    static {
        TREE_SITTER_LANGUAGES.put(Language.CPP, new TreeSitterCpp());
    }

    public static void main(String[] args) throws Exception {
        List<String> positional = new ArrayList<>();
        boolean baseline = false;
        boolean failOnError = false;
        for (String arg : args) {
            switch (arg) {
                case "--baseline" -> baseline = true;
                case "--fail-on-error" -> failOnError = true;
                default -> positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            System.err.println("Usage: java -jar patternframe.jar <input> <output-file> [--baseline] [--fail-on-error]");
            System.err.println("  <input>:          C/C++ source file or directory");
            System.err.println("  <output-file>:    JSONL file with one analysis per source file");
            System.err.println("  --baseline:       write one sorted JSON array of all extracted strings instead");
            System.err.println("  --fail-on-error:  stop at the first file whose extraction reports errors");
            System.exit(2);
        }

        Path input = Paths.get(positional.get(0));
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(positional.get(1));
        int exitCode = run(input, output, baseline, failOnError, PatternframeConfig.load());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * @return the process exit code: 0, or 1 when {@code failOnError} stopped the run
     */
    public static int run(Path input, Path output, boolean baseline, boolean failOnError,
                          PatternframeConfig config) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        System.out.println("Starting string extraction...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        RunStats stats = new RunStats(files.size());
        Set<String> baselineStrings = new ConcurrentSkipListSet<>();
        boolean stopped;

        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            if (!baseline) {
                Map<String, Object> runInfo = new HashMap<>();
                runInfo.put("kind", "run");
                runInfo.put("started_at", startTime.toString());
                runInfo.put("input_path", input.toString());
                runInfo.put("total_files", files.size());
                writeLine(writer, runInfo);
            }

            FileSink sink = analysis -> {
                if (baseline) {
                    if (analysis.isComplete()) {
                        for (String s : analysis.allStrings()) {
                            if (LiteralNormalizer.wordCount(s) >= config.getBaselineMinWords()) {
                                baselineStrings.add(s);
                            }
                        }
                    }
                } else {
                    writeLine(writer, analysis);
                }
            };

            if (failOnError) {
                // Sequential so that the first failing file really ends the run
                stopped = false;
                for (Path file : files) {
                    if (!processFile(file, config, sink, writer, baseline, stats)) {
                        System.err.println("Stopping: extraction failed for " + file);
                        stopped = true;
                        break;
                    }
                }
            } else {
                stopped = false;
                files.parallelStream().forEach(file -> processFile(file, config, sink, writer, baseline, stats));
            }

            Instant endTime = Instant.now();
            if (baseline) {
                writer.write(PRETTY_MAPPER.writeValueAsString(baselineStrings));
                writer.newLine();
            } else {
                Map<String, Object> doneInfo = new HashMap<>();
                doneInfo.put("kind", "done");
                doneInfo.put("ended_at", endTime.toString());
                doneInfo.put("files_analyzed", stats.success.get());
                doneInfo.put("files_with_extraction_errors", stats.extractionErrors.get());
                doneInfo.put("files_failed", stats.failed.get());
                doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
                writeLine(writer, doneInfo);
            }
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println(stopped ? "Extraction stopped on error." : "Extraction complete!");
        System.out.println("Successfully analyzed: " + stats.success.get() + " files");
        if (stats.extractionErrors.get() > 0) {
            System.out.println("Files with extraction errors: " + stats.extractionErrors.get());
        }
        if (stats.failed.get() > 0) {
            System.out.println("Files that could not be read or parsed: " + stats.failed.get());
        }
        if (baseline) {
            System.out.println("Baseline saved with " + baselineStrings.size() + " unique entries");
        }
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));

        return stopped ? 1 : 0;
    }

    /**
     * @return false when the file could not be analyzed or its extraction reported errors
     */
    private static boolean processFile(Path file, PatternframeConfig config, FileSink sink,
                                       BufferedWriter writer, boolean baseline, RunStats stats) {
        Optional<Language> langOpt = LanguageDetector.detectLanguage(file);
        if (langOpt.isEmpty()) {
            return true;
        }

        Language language = langOpt.get();
        int current = stats.progress.incrementAndGet();
        synchronized (System.out) {
            System.out.println("[" + current + "/" + stats.total + "] Extracting " +
                    language.getName() + ": " + file.getFileName());
        }

        try {
            FileAnalysis analysis = analyzeFile(file, language, config);
            sink.accept(analysis);
            if (analysis.isComplete()) {
                stats.success.incrementAndGet();
                return true;
            }

            stats.extractionErrors.incrementAndGet();
            synchronized (System.err) {
                System.err.println("  Extraction errors in " + file.getFileName() + ":");
                for (ExtractionError error : analysis.errors) {
                    System.err.println("  " + error.message.replace("\n", "\n  "));
                }
            }
            return false;
        } catch (IOException | RuntimeException e) {
            stats.failed.incrementAndGet();
            if (!baseline) {
                Map<String, String> error = new HashMap<>();
                error.put("kind", "error");
                error.put("file", file.toString());
                error.put("language", language.getName());
                error.put("error", e.getMessage());
                try {
                    writeLine(writer, error);
                } catch (UncheckedIOException ioException) {
                    System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                }
            }
            synchronized (System.err) {
                System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
            }
            return false;
        }
    }

    private static void writeLine(BufferedWriter writer, Object value) {
        try {
            String line = MAPPER.writeValueAsString(value);
            synchronized (writer) {
                writer.write(line);
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<Path> collectSourceFiles(Path input, PatternframeConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        PathExcluder excluder = new PathExcluder(config.getExcludes());
        int maxFileLines = config.getMaxFileLines();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> excluder.accepts(input, p))
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (excluder.accepts(input.getFileName())
                    && LanguageDetector.detectLanguage(input).isPresent()
                    && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // Unreadable here means unreadable later too; let analyzeFile report it
            return true;
        }
    }

    public static FileAnalysis analyzeFile(Path filePath, Language language, PatternframeConfig config) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);
        return analyzeSource(filePath.toString(), sourceCode, language, config);
    }

    public static FileAnalysis analyzeSource(String filePath, String sourceCode, Language language,
                                             PatternframeConfig config) {
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        TSLanguage tsLanguage = TREE_SITTER_LANGUAGES.get(language);
        if (tsLanguage == null) {
            throw new IllegalArgumentException("No Tree-sitter language available for: " + language);
        }

        TSParser parser = new TSParser();
        parser.setLanguage(tsLanguage);
        TSTree tree = parser.parseString(null, sourceCode);
        try {
            return (FileAnalysis) createAnalyzer(language, config)
                    .analyze(filePath, sourceCode, new TreeSitterSyntaxNode(tree.getRootNode()));
        } finally {
            Reference.reachabilityFence(tree);
        }
    }

    private static LanguageAnalyzer createAnalyzer(Language language, PatternframeConfig config) {
        return switch (language) {
            case CPP -> new CppAnalyzer(config);
        };
    }

    @FunctionalInterface
    private interface FileSink {
        void accept(FileAnalysis analysis);
    }

    private static class RunStats {
        final int total;
        final AtomicInteger progress = new AtomicInteger(0);
        final AtomicInteger success = new AtomicInteger(0);
        final AtomicInteger extractionErrors = new AtomicInteger(0);
        final AtomicInteger failed = new AtomicInteger(0);

        RunStats(int total) {
            this.total = total;
        }
    }
}
