package com.vidyarthi.node.kernel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidyarthi.node.consent.PrivacyPolicy;
import com.vidyarthi.node.key.KeyVault.KeyRotationPolicy;
import com.vidyarthi.node.safety.SecurityEventLog;
import com.vidyarthi.node.transport.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for every service the kernel builds.
 *
 * Read from a JSON document ({@value #DEFAULT_RESOURCE} on the classpath by default);
 * missing sections keep their defaults. Development mode can also be switched on with
 * {@code VIDYARTHI_ENV=development}.
 */
public record NodeConfig(
        KeyRotationPolicy keyRotation,
        PrivacyPolicy privacyPolicy,
        GatewayConfig gateway,
        int securityEventCapacity
) {

    private static final Logger log = LoggerFactory.getLogger(NodeConfig.class);

    public static final String DEFAULT_RESOURCE = "vidyarthi-node.json";
    public static final String ENVIRONMENT_VARIABLE = "VIDYARTHI_ENV";
    public static final String DEVELOPMENT = "development";

    public NodeConfig {
        Objects.requireNonNull(keyRotation, "Key rotation policy cannot be null");
        Objects.requireNonNull(privacyPolicy, "Privacy policy cannot be null");
        Objects.requireNonNull(gateway, "Gateway config cannot be null");
        if (securityEventCapacity < 1) {
            throw new IllegalArgumentException("Security event capacity must be positive");
        }
    }

    public static NodeConfig defaults() {
        return new NodeConfig(
                KeyRotationPolicy.defaults(),
                PrivacyPolicy.defaults(),
                GatewayConfig.defaults(),
                SecurityEventLog.DEFAULT_CAPACITY
        );
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath and applies the process environment.
     */
    public static NodeConfig load() {
        return fromResource(DEFAULT_RESOURCE).withEnvironment(System.getenv());
    }

    /**
     * Loads a classpath resource, or returns the defaults if there is none.
     *
     * @throws ConfigException if the resource exists but is not a valid document
     */
    public static NodeConfig fromResource(String resource) {
        try (InputStream in = NodeConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("No {} on the classpath, using defaults", resource);
                return defaults();
            }
            return read(in);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + resource, e);
        }
    }

    /**
     * Parses a JSON configuration document.
     *
     * @throws ConfigException if the document is malformed or holds invalid values
     */
    public static NodeConfig read(InputStream in) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        ConfigDocument document;
        try {
            document = mapper.readValue(in, ConfigDocument.class);
        } catch (IOException e) {
            throw new ConfigException("Malformed configuration document", e);
        }
        try {
            return document.toConfig();
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Switches on development mode if {@value #ENVIRONMENT_VARIABLE} is {@value #DEVELOPMENT}.
     */
    public NodeConfig withEnvironment(Map<String, String> environment) {
        String value = environment.get(ENVIRONMENT_VARIABLE);
        if (value != null && value.trim().equalsIgnoreCase(DEVELOPMENT)) {
            log.warn("Development mode enabled: outbound host allowlist is not enforced");
            return withGateway(gateway.withDevelopmentMode(true));
        }
        return this;
    }

    public NodeConfig withGateway(GatewayConfig gatewayConfig) {
        return new NodeConfig(keyRotation, privacyPolicy, gatewayConfig, securityEventCapacity);
    }

    public static class ConfigException extends RuntimeException {
        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    // ==================== File Format ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigDocument {
        public String environment;
        public KeyRotationSection keyRotation = new KeyRotationSection();
        public PrivacyPolicySection privacyPolicy = new PrivacyPolicySection();
        public GatewaySection gateway = new GatewaySection();
        public int securityEventCapacity = SecurityEventLog.DEFAULT_CAPACITY;

        NodeConfig toConfig() {
            GatewayConfig gatewayConfig = gateway.toConfig();
            if (DEVELOPMENT.equalsIgnoreCase(environment)) {
                gatewayConfig = gatewayConfig.withDevelopmentMode(true);
            }
            return new NodeConfig(keyRotation.toPolicy(), privacyPolicy.toPolicy(), gatewayConfig, securityEventCapacity);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class KeyRotationSection {
        public long rotationDays = KeyRotationPolicy.defaults().rotationInterval().toDays();
        public int keyLength = KeyRotationPolicy.defaults().keyLength();

        KeyRotationPolicy toPolicy() {
            return new KeyRotationPolicy(Duration.ofDays(rotationDays), keyLength);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PrivacyPolicySection {
        public String version = PrivacyPolicy.defaults().version();
        public String lastUpdated = PrivacyPolicy.defaults().lastUpdated().toString();
        public int validityMonths = PrivacyPolicy.defaults().validityMonths();

        PrivacyPolicy toPolicy() {
            return new PrivacyPolicy(version, LocalDate.parse(lastUpdated), validityMonths);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GatewaySection {
        public List<String> allowedHosts = GatewayConfig.DEFAULT_ALLOWED_HOSTS;
        public long requestTimeoutSeconds = GatewayConfig.defaults().requestTimeout().toSeconds();
        public int maxRetries = GatewayConfig.defaults().maxRetries();
        public long retryDelayMillis = GatewayConfig.defaults().retryDelay().toMillis();
        public boolean developmentMode = false;
        public String userAgent = GatewayConfig.defaults().userAgent();

        GatewayConfig toConfig() {
            return new GatewayConfig(
                    allowedHosts,
                    Duration.ofSeconds(requestTimeoutSeconds),
                    maxRetries,
                    Duration.ofMillis(retryDelayMillis),
                    developmentMode,
                    userAgent
            );
        }
    }
}
