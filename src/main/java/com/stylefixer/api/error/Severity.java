package com.stylefixer.api.error;

public enum Severity {
    FATAL,   // The file could not be read or parsed
    ERROR,   // A fix could not be applied
    WARNING, // A rule violation that remains in the file
    INFO;    // A violation that was fixed, or other progress notes

    /**
     * Whether an error of this severity makes the file's result unsuccessful.
     */
    public boolean isFailure() {
        return this == FATAL || this == ERROR;
    }
}
