package dev.mars.autoflow.workflow.validation;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.autoflow.core.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Errors and warnings collected while validating node configuration or a workflow
 * graph. Each issue carries the dotted path of the offending field.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, null, message));
    }

    public void addError(String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, fieldPath, message));
    }

    /**
     * Copies the issues of another result, prefixing their field paths.
     */
    public void merge(String pathPrefix, ValidationResult other) {
        for (ValidationIssue issue : other.errors) {
            errors.add(issue.withPrefix(pathPrefix));
        }
        for (ValidationIssue issue : other.warnings) {
            warnings.add(issue.withPrefix(pathPrefix));
        }
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    /**
     * @throws ValidationException listing every error, if there are any
     */
    public void throwIfInvalid(String message) throws ValidationException {
        if (!isValid()) {
            throw new ValidationException(message, errors.stream().map(ValidationIssue::toString).toList());
        }
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", errors=" + errors.size()
                + ", warnings=" + warnings.size() + "}";
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        ValidationIssue withPrefix(String prefix) {
            if (prefix == null || prefix.isEmpty()) {
                return this;
            }
            return new ValidationIssue(severity, fieldPath == null ? prefix : prefix + "." + fieldPath, message);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(fieldPath, that.fieldPath) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, fieldPath, message);
        }

        @Override
        public String toString() {
            return fieldPath == null ? message : fieldPath + ": " + message;
        }
    }
}
