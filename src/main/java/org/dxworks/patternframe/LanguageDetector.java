package org.dxworks.patternframe;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (Language language : Language.values()) {
            if (language.matchesFileName(name)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
