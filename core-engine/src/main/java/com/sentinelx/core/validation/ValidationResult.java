package com.sentinelx.core.validation;

import java.util.Objects;

/**
 * Outcome of validating one risk report: valid, or invalid with a reason.
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(true, "");

    private final boolean valid;
    private final String reason;

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, Objects.requireNonNull(reason, "reason must not be null"));
    }

    public boolean isValid() {
        return valid;
    }

    /** Empty when valid. */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationResult that))
            return false;
        return valid == that.valid && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, reason);
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{invalid: " + reason + '}';
    }
}
