package com.randomtable.engine.validator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Issues found in a document. The document is valid when none of them is an error. */
public final class ValidationResult {
    public final boolean valid;
    public final List<ValidationIssue> issues;

    public ValidationResult(List<ValidationIssue> issues) {
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.valid = errors().isEmpty();
    }

    public List<ValidationIssue> errors() {
        return filter(ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return filter(ValidationSeverity.WARNING);
    }

    public boolean hasCode(String code) {
        for (ValidationIssue i : issues) {
            if (i.code.equals(code)) return true;
        }
        return false;
    }

    private List<ValidationIssue> filter(ValidationSeverity severity) {
        List<ValidationIssue> out = new ArrayList<>();
        for (ValidationIssue i : issues) {
            if (i.severity == severity) out.add(i);
        }
        return out;
    }
}
