package com.taleforge.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated outcome of a validation pass.
 *
 * Invariants:
 * - valid if and only if errors is empty
 * - merge is associative and preserves order: this result's entries first
 */
public record ValidationResult(
    List<FieldError> errors,
    List<FieldError> warnings
) {
    private static final ValidationResult OK = new ValidationResult(List.of(), List.of());

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult error(String path, String code, String message) {
        return new ValidationResult(List.of(new FieldError(path, code, message)), List.of());
    }

    public static ValidationResult warning(String path, String code, String message) {
        return new ValidationResult(List.of(), List.of(new FieldError(path, code, message)));
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public ValidationResult merge(ValidationResult other) {
        if (other.errors.isEmpty() && other.warnings.isEmpty()) {
            return this;
        }
        List<FieldError> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        List<FieldError> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return new ValidationResult(mergedErrors, mergedWarnings);
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public boolean hasWarningCode(String code) {
        return warnings.stream().anyMatch(w -> w.code().equals(code));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator for a single validator pass.
     */
    public static class Builder {
        private final List<FieldError> errors = new ArrayList<>();
        private final List<FieldError> warnings = new ArrayList<>();

        public Builder error(String path, String code, String message) {
            errors.add(new FieldError(path, code, message));
            return this;
        }

        public Builder warning(String path, String code, String message) {
            warnings.add(new FieldError(path, code, message));
            return this;
        }

        public Builder merge(ValidationResult other) {
            errors.addAll(other.errors());
            warnings.addAll(other.warnings());
            return this;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }

        public ValidationResult build() {
            return new ValidationResult(errors, warnings);
        }
    }
}
