package com.stylefixer.api;

import com.stylefixer.syntax.TextSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rule violation found by an analyzer: the rule, the offending source span and optional arguments.
 */
public final class Diagnostic {
    private final String ruleId;
    private final TextSpan span;
    private final String message;
    private final Map<String, String> properties;

    public Diagnostic(String ruleId, TextSpan span, String message) {
        this(ruleId, span, message, Collections.emptyMap());
    }

    public Diagnostic(String ruleId, TextSpan span, String message, Map<String, String> properties) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.span = Objects.requireNonNull(span, "span");
        this.message = message;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String getRuleId() {
        return ruleId;
    }

    public TextSpan getSpan() {
        return span;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic other = (Diagnostic) o;
        return ruleId.equals(other.ruleId) && span.equals(other.span) && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, span, properties);
    }

    @Override
    public String toString() {
        return ruleId + span + (message == null ? "" : ": " + message);
    }
}
