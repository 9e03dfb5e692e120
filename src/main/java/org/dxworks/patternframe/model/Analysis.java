package org.dxworks.patternframe.model;

/**
 * Common shape of every per-file result written by the CLI.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
