package com.randomtable.engine.validator;

public enum ValidationSeverity {
    ERROR,
    WARNING,
    INFO
}
