package com.vidyarthi.node.safety;

import com.vidyarthi.node.common.Outcome;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validators and sanitizers for untrusted strings, plus heuristic threat detection.
 *
 * The guard holds no state of its own; detections are reported to the
 * {@link SecurityEventLog} with the pattern name and input length only.
 */
public class InputGuard {

    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_FILENAME_LENGTH = 255;
    public static final int MIN_PASSWORD_LENGTH = 6;
    public static final int MAX_PASSWORD_LENGTH = 128;
    public static final String DEFAULT_FILENAME = "unnamed_file";

    private static final List<Pattern> STRIP_PATTERNS = List.of(
            Pattern.compile("<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("<iframe[^>]*>.*?</iframe>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE)
    );

    // an ampersand that does not already open one of the entities produced below
    private static final Pattern BARE_AMPERSAND = Pattern.compile("&(?!(?:amp|lt|gt|quot|#x27);)");

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final Pattern PHONE_FORMATTING = Pattern.compile("[\\s\\-()+]");
    private static final Pattern PHONE_DIGITS = Pattern.compile("^\\d{10,15}$");

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    private static final List<InjectionPattern> INJECTION_PATTERNS = List.of(
            new InjectionPattern("quote-or-string-tautology", Pattern.compile("'\\s*OR\\s*'1'\\s*=\\s*'1", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("quote-or-numeric-tautology", Pattern.compile("'\\s*OR\\s*1\\s*=\\s*1", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("comment-marker", Pattern.compile("--")),
            new InjectionPattern("drop-table", Pattern.compile(";\\s*DROP\\s+TABLE", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("delete-from", Pattern.compile(";\\s*DELETE\\s+FROM", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("union-select", Pattern.compile("UNION\\s+SELECT", Pattern.CASE_INSENSITIVE)),
            new InjectionPattern("script-tag", Pattern.compile("<script", Pattern.CASE_INSENSITIVE))
    );

    private static final Set<String> WEAK_PASSWORDS = Set.of(
            "123456", "password", "123456789", "12345678", "12345",
            "1234567", "1234567890", "qwerty", "abc123", "password123",
            "111111", "123123", "admin", "letmein", "welcome"
    );

    private static final List<String> FILENAME_FORBIDDEN = List.of(
            "..", "/", "\\", ":", "*", "?", "\"", "<", ">", "|"
    );

    private final SecurityEventLog securityEvents;

    public InputGuard(SecurityEventLog securityEvents) {
        this.securityEvents = Objects.requireNonNull(securityEvents, "SecurityEventLog cannot be null");
    }

    public InputGuard() {
        this(new SecurityEventLog());
    }

    /**
     * Removes script/iframe blocks, {@code javascript:} and inline event handlers, then
     * HTML-escapes {@code & < > " '} and trims. Applying it twice changes nothing.
     *
     * @return sanitized text, empty for null
     */
    public String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = text;
        String previous;
        // removal can splice a new match together ("jajavascript:vascript:"), so repeat until stable
        do {
            previous = stripped;
            for (Pattern pattern : STRIP_PATTERNS) {
                stripped = pattern.matcher(stripped).replaceAll("");
            }
        } while (!stripped.equals(previous));

        String escaped = BARE_AMPERSAND.matcher(stripped).replaceAll("&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#x27;");
        return escaped.trim();
    }

    public boolean isValidEmail(String email) {
        if (email == null || email.isEmpty()) {
            return false;
        }
        return email.length() <= MAX_EMAIL_LENGTH && EMAIL.matcher(email).matches();
    }

    /**
     * Accepts only http/https URLs with a non-empty host.
     */
    public boolean isValidUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("data:")) {
            return false;
        }
        return parseHttpUri(url).isPresent();
    }

    /**
     * Accepts 10 to 15 digits once spaces, dashes, parentheses and plus signs are removed.
     */
    public boolean isValidPhone(String phone) {
        if (phone == null || phone.isEmpty()) {
            return false;
        }
        String cleaned = PHONE_FORMATTING.matcher(phone).replaceAll("");
        return PHONE_DIGITS.matcher(cleaned).matches();
    }

    /**
     * Checks text against SQL and script injection heuristics.
     * A match is recorded as a security event with the pattern name and input length.
     */
    public boolean containsInjectionPattern(String text) {
        return findInjectionPattern(text).isPresent();
    }

    /**
     * Gets the name of the first injection heuristic the text matches.
     */
    public Optional<String> findInjectionPattern(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (InjectionPattern candidate : INJECTION_PATTERNS) {
            if (candidate.pattern().matcher(text).find()) {
                securityEvents.warn("Injection pattern detected", Map.of(
                        "pattern", candidate.name(),
                        "input_length", text.length()
                ));
                return Optional.of(candidate.name());
            }
        }
        return Optional.empty();
    }

    public PasswordStrength passwordStrength(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            return PasswordStrength.WEAK;
        }
        int score = 0;
        if (password.length() >= 8) score++;
        if (password.length() >= 12) score++;
        if (UPPERCASE.matcher(password).find()) score++;
        if (LOWERCASE.matcher(password).find()) score++;
        if (DIGIT.matcher(password).find()) score++;
        if (SPECIAL.matcher(password).find()) score++;

        if (score >= 5) return PasswordStrength.STRONG;
        if (score >= 3) return PasswordStrength.MEDIUM;
        return PasswordStrength.WEAK;
    }

    public boolean isKnownWeakPassword(String password) {
        return password != null && WEAK_PASSWORDS.contains(password.toLowerCase(Locale.ROOT));
    }

    /**
     * Removes path traversal and reserved filesystem characters and caps the length.
     */
    public String sanitizeFilename(String name) {
        if (name == null || name.isEmpty()) {
            return DEFAULT_FILENAME;
        }
        String sanitized = name;
        String previous;
        // "./." becomes ".." once the slash is gone
        do {
            previous = sanitized;
            for (String forbidden : FILENAME_FORBIDDEN) {
                sanitized = sanitized.replace(forbidden, "");
            }
        } while (!sanitized.equals(previous));
        if (sanitized.length() > MAX_FILENAME_LENGTH) {
            sanitized = sanitized.substring(0, MAX_FILENAME_LENGTH);
        }
        sanitized = sanitized.trim();
        return sanitized.isEmpty() ? DEFAULT_FILENAME : sanitized;
    }

    /**
     * Validates an email for sign-up forms.
     *
     * @return {@code Ok} with the trimmed address, or {@code Failed} with a user-facing reason
     */
    public Outcome<String> validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return Outcome.failed("Email is required");
        }
        String trimmed = email.trim();
        if (trimmed.length() > MAX_EMAIL_LENGTH) {
            return Outcome.failed("Email is too long");
        }
        if (!isValidEmail(trimmed)) {
            return Outcome.failed("Email format is invalid");
        }
        return Outcome.ok(trimmed);
    }

    /**
     * Validates a new password.
     *
     * @return {@code Ok} with its strength, or {@code Failed} with a user-facing reason
     */
    public Outcome<PasswordStrength> validatePassword(String password) {
        if (password == null || password.isEmpty()) {
            return Outcome.failed("Password is required");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            return Outcome.failed("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.length() > MAX_PASSWORD_LENGTH) {
            return Outcome.failed("Password must be at most " + MAX_PASSWORD_LENGTH + " characters");
        }
        if (isKnownWeakPassword(password)) {
            return Outcome.failed("Password is too common");
        }
        return Outcome.ok(passwordStrength(password));
    }

    /**
     * Parses a URL and keeps it only if it is http/https with a host.
     */
    public static Optional<URI> parseHttpUri(String url) {
        if (url == null) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null) {
                return Optional.empty();
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            if (!normalized.equals("http") && !normalized.equals("https")) {
                return Optional.empty();
            }
            String host = uri.getHost();
            if (host == null || host.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private record InjectionPattern(String name, Pattern pattern) {}
}
