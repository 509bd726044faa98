package com.vidyarthi.node.kernel;

import com.vidyarthi.node.audit.AccessLog;
import com.vidyarthi.node.cipher.StreamObfuscator;
import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.consent.ConsentLedger;
import com.vidyarthi.node.consent.DataErasureService;
import com.vidyarthi.node.key.KeyVault;
import com.vidyarthi.node.key.SecretGenerator;
import com.vidyarthi.node.ratelimit.RateLimiter;
import com.vidyarthi.node.safety.InputGuard;
import com.vidyarthi.node.safety.SecurityEventLog;
import com.vidyarthi.node.store.JsonFileKeyValueStore;
import com.vidyarthi.node.store.KeyValueStore;
import com.vidyarthi.node.transport.HttpTransport;
import com.vidyarthi.node.transport.JdkHttpTransport;
import com.vidyarthi.node.transport.SecureGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Composition root of the data-protection layer.
 *
 * Builds exactly one instance of each service over a single store and hands them to
 * the application. Boot order: finish any interrupted erasure, make sure a secret key
 * exists, check whether it is due for rotation.
 *
 * <p>The kernel never rotates on its own: rotation makes every stored ciphertext
 * undecodable. When {@link BootResult#rotationDue()} is set, the application keeps the
 * old key from {@link KeyVault#currentKey()}, calls {@link KeyVault#rotate()}, and
 * re-encodes what it still needs with {@link StreamObfuscator#decode(String, String)}.
 */
public class PrivacyKernel {

    private static final Logger log = LoggerFactory.getLogger(PrivacyKernel.class);

    private final NodeConfig config;
    private final Clock clock;
    private final AtomicReference<KernelState> state;

    private final SecurityEventLog securityEvents;
    private final InputGuard inputGuard;
    private final KeyVault keyVault;
    private final StreamObfuscator obfuscator;
    private final RateLimiter rateLimiter;
    private final AccessLog accessLog;
    private final ConsentLedger consentLedger;
    private final DataErasureService erasureService;
    private final SecureGateway gateway;

    private volatile Instant bootTime;

    /**
     * @param config    settings; defaults when null
     * @param store     persistent store shared by every service
     * @param transport HTTP transport behind the gateway; a {@link JdkHttpTransport} when null
     * @param clock     time source; system UTC when null
     */
    public PrivacyKernel(NodeConfig config, KeyValueStore store, HttpTransport transport, Clock clock) {
        Objects.requireNonNull(store, "Store cannot be null");
        this.config = config != null ? config : NodeConfig.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.state = new AtomicReference<>(KernelState.CREATED);

        this.securityEvents = new SecurityEventLog(this.config.securityEventCapacity(), this.clock);
        this.inputGuard = new InputGuard(securityEvents);
        this.keyVault = new KeyVault(store, this.config.keyRotation(), new SecretGenerator(), this.clock);
        this.obfuscator = new StreamObfuscator(keyVault);
        this.rateLimiter = new RateLimiter(this.clock);
        this.accessLog = new AccessLog(store, this.clock);
        this.consentLedger = new ConsentLedger(store, accessLog, this.config.privacyPolicy(), this.clock);
        this.erasureService = new DataErasureService(store, consentLedger, keyVault);
        this.gateway = new SecureGateway(
                transport != null ? transport : new JdkHttpTransport(),
                inputGuard,
                securityEvents,
                this.config.gateway()
        );
    }

    public PrivacyKernel(NodeConfig config, KeyValueStore store) {
        this(config, store, null, Clock.systemUTC());
    }

    /**
     * Opens a kernel over a JSON store file.
     */
    public static PrivacyKernel open(Path storeFile, NodeConfig config) {
        return new PrivacyKernel(config, new JsonFileKeyValueStore(storeFile));
    }

    /**
     * Runs the boot sequence. Calling it again once running does nothing.
     */
    public BootResult start() {
        if (state.get() == KernelState.RUNNING) {
            return new BootResult(true, false, false, "Kernel already running", bootTime);
        }
        if (!state.compareAndSet(KernelState.CREATED, KernelState.BOOTING)
                && !state.compareAndSet(KernelState.FAILED, KernelState.BOOTING)) {
            return new BootResult(false, false, false, "Cannot start kernel from state: " + state.get(), bootTime);
        }

        Outcome<Boolean> resumed = erasureService.resumePendingErasure();
        if (!resumed.isOk()) {
            return fail("Pending erasure could not be completed: " + resumed.reason().orElse("unknown"));
        }

        Outcome<Void> key = keyVault.ensureKey();
        if (!key.isOk()) {
            return fail("Secret key unavailable: " + key.reason().orElse("unknown"));
        }

        boolean rotationDue = keyVault.needsRotation();
        if (rotationDue) {
            log.info("Secret key is due for rotation");
        }

        bootTime = clock.instant();
        state.set(KernelState.RUNNING);
        boolean erasureResumed = resumed.orElse(false);
        log.info("Privacy kernel started (erasureResumed={}, rotationDue={})", erasureResumed, rotationDue);
        return new BootResult(true, erasureResumed, rotationDue, "Kernel started", bootTime);
    }

    public KernelState state() {
        return state.get();
    }

    public NodeConfig config() {
        return config;
    }

    public SecurityEventLog securityEvents() {
        return securityEvents;
    }

    public InputGuard inputGuard() {
        return inputGuard;
    }

    public KeyVault keyVault() {
        return keyVault;
    }

    public StreamObfuscator obfuscator() {
        return obfuscator;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public ConsentLedger consentLedger() {
        return consentLedger;
    }

    public DataErasureService erasureService() {
        return erasureService;
    }

    public SecureGateway gateway() {
        return gateway;
    }

    private BootResult fail(String message) {
        log.error("Privacy kernel failed to start: {}", message);
        state.set(KernelState.FAILED);
        return new BootResult(false, false, false, message, null);
    }

    public enum KernelState {
        CREATED,
        BOOTING,
        RUNNING,
        FAILED
    }

    /**
     * Result of {@link #start()}.
     */
    public record BootResult(
            boolean success,
            boolean erasureResumed,
            boolean rotationDue,
            String message,
            Instant bootTime
    ) {}
}
