package com.stylefixer.plugins;

import java.nio.file.Path;

/**
 * Source file types the fixer can handle, detected by extension.
 */
public enum FileType {
    CSHARP("cs"),
    UNKNOWN("");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static FileType detect(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase();
        if (!name.contains(".")) {
            return UNKNOWN;
        }

        String extension = name.substring(name.lastIndexOf('.') + 1);
        return switch (extension) {
            case "cs" -> CSHARP;
            default -> UNKNOWN;
        };
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case CSHARP -> "C# source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
