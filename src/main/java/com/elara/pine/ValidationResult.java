package com.elara.pine;

/** Syntax-only verdict from {@link PineTranspiler#validate(String)}. */
public final class ValidationResult {
    public final boolean valid;
    public final String reason; // null when valid

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }

    @Override
    public String toString() {
        return valid ? "valid" : "invalid: " + reason;
    }
}
