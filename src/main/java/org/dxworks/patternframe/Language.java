package org.dxworks.patternframe;

import java.util.List;

public enum Language {
    CPP("cpp", List.of(".cpp", ".cc", ".cxx", ".c", ".hpp", ".h"));

    private final String name;
    private final List<String> extensions;

    Language(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) return true;
        }
        return false;
    }
}
