package com.randomtable.engine.validator;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One finding against a document. {@code path} is a JSON-style path such as {@code tables[2].entries[0].id}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ValidationIssue {
    public final ValidationSeverity severity;
    public final String code;
    public final String message;
    public final String path;
    public final String suggestion;

    public ValidationIssue(ValidationSeverity severity, String code, String message, String path, String suggestion) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.path = path;
        this.suggestion = suggestion;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(code).append(": ").append(message);
        if (path != null) sb.append(" (at ").append(path).append(')');
        return sb.toString();
    }
}
