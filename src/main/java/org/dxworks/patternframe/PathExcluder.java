package org.dxworks.patternframe;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Path exclusion by substring or glob. A pattern excludes a path when the path contains it, when
 * the glob matches the whole path, or when the glob matches the file name alone.
 * <p>
 * Paths are matched relative to the scanned root, so directories above the root never exclude anything.
 */
public class PathExcluder {
    private final List<String> substrings = new ArrayList<>();
    private final List<PathMatcher> globs = new ArrayList<>();

    public PathExcluder(List<String> patterns) {
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) continue;
            substrings.add(pattern);
            try {
                globs.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            } catch (PatternSyntaxException e) {
                System.err.println("Warning: exclude pattern '" + pattern + "' is not a valid glob, matching it as a substring only");
            }
        }
    }

    public boolean isExcluded(Path path) {
        String text = path.toString().replace('\\', '/');
        for (String substring : substrings) {
            if (text.contains(substring)) return true;
        }
        Path fileName = path.getFileName();
        for (PathMatcher glob : globs) {
            if (glob.matches(path) || (fileName != null && glob.matches(fileName))) return true;
        }
        return false;
    }

    public boolean accepts(Path path) {
        return !isExcluded(path);
    }

    public boolean accepts(Path root, Path path) {
        return accepts(root.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize()));
    }
}
