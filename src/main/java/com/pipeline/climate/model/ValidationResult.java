package com.pipeline.climate.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 算子参数校验结果。错误使步骤失败，警告只记录日志。
 */
public class ValidationResult implements Serializable {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public static ValidationResult success() {
        return new ValidationResult();
    }

    public static ValidationResult failure(String error) {
        ValidationResult result = new ValidationResult();
        result.addError(error);
        return result;
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

    @Override
    public String toString() {
        return valid ? "valid" + (warnings.isEmpty() ? "" : " with warnings " + warnings) : "invalid " + errors;
    }
}
