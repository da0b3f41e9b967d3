package com.stylefixer.api;

import java.util.ArrayList;
import java.util.List;

import com.stylefixer.api.error.FixerError;

/**
 * Result of fixing or checking one file.
 */
public class FixResult {
    private final boolean successful;
    private final String originalCode;
    private final String fixedCode;
    private final List<FixerError> errors;
    private final List<AppliedFix> appliedFixes;

    private FixResult(Builder builder) {
        this.successful = builder.successful;
        this.originalCode = builder.originalCode;
        this.fixedCode = builder.fixedCode;
        this.errors = builder.errors;
        this.appliedFixes = builder.appliedFixes;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getOriginalCode() {
        return originalCode;
    }

    /**
     * Rewritten source, {@code null} when the file could not be processed.
     */
    public String getFixedCode() {
        return fixedCode;
    }

    /**
     * Whether the rewritten source differs from the input.
     */
    public boolean isChanged() {
        return fixedCode != null && !fixedCode.equals(originalCode);
    }

    public List<FixerError> getErrors() {
        return errors;
    }

    public List<AppliedFix> getAppliedFixes() {
        return appliedFixes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String originalCode;
        private String fixedCode;
        private List<FixerError> errors = new ArrayList<>();
        private List<AppliedFix> appliedFixes = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder originalCode(String originalCode) {
            this.originalCode = originalCode;
            return this;
        }

        public Builder fixedCode(String fixedCode) {
            this.fixedCode = fixedCode;
            return this;
        }

        public Builder addError(FixerError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FixerError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder addAppliedFix(AppliedFix fix) {
            this.appliedFixes.add(fix);
            return this;
        }

        public Builder appliedFixes(List<AppliedFix> fixes) {
            this.appliedFixes = new ArrayList<>(fixes);
            return this;
        }

        public FixResult build() {
            return new FixResult(this);
        }
    }
}
