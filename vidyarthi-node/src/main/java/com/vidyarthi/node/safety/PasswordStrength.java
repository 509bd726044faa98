package com.vidyarthi.node.safety;

/**
 * Password strength buckets with user-facing text.
 */
public enum PasswordStrength {
    WEAK("Weak", "Too weak. Add uppercase, numbers, and symbols."),
    MEDIUM("Medium", "Fair. Add more characters or symbols."),
    STRONG("Strong", "Strong password!");

    private final String label;
    private final String description;

    PasswordStrength(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }
}
