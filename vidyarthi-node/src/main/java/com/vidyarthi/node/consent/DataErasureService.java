package com.vidyarthi.node.consent;

import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.key.KeyVault;
import com.vidyarthi.node.store.KeyValueStore;
import com.vidyarthi.node.store.KeyValueStore.StoreException;
import com.vidyarthi.node.store.StoreKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Right-to-be-forgotten across the consent ledger and the key vault.
 *
 * <p>Erasure runs as: set the {@code erasure_pending} marker, wipe the secret key,
 * clear the store (which drops the marker). A crash between steps leaves the marker
 * behind, and {@link #resumePendingErasure()} finishes the job on the next start.
 */
public class DataErasureService {

    private static final Logger log = LoggerFactory.getLogger(DataErasureService.class);

    private final KeyValueStore store;
    private final ConsentLedger ledger;
    private final KeyVault keyVault;

    public DataErasureService(KeyValueStore store, ConsentLedger ledger, KeyVault keyVault) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.keyVault = Objects.requireNonNull(keyVault, "Key vault cannot be null");
    }

    /**
     * Erases the secret key and every stored value.
     *
     * @return {@code Ok} once both are gone; {@code Failed} if a step failed, in which
     *         case the marker stays set whenever it could be written
     */
    public Outcome<Void> eraseEverything() {
        try {
            store.setBoolean(StoreKeys.ERASURE_PENDING, true);
        } catch (StoreException e) {
            log.error("Could not start erasure: {}", e.getMessage());
            return Outcome.failed("Erasure could not be started", e);
        }

        Outcome<Void> wiped = keyVault.wipe();
        if (!wiped.isOk()) {
            log.error("Erasure interrupted while wiping the key, will resume on next start");
            return wiped;
        }

        Outcome<Void> erased = ledger.eraseAll();
        if (!erased.isOk()) {
            log.error("Erasure interrupted while clearing the store, will resume on next start");
            return erased;
        }
        log.info("Erasure complete");
        return Outcome.done();
    }

    /**
     * True if an earlier erasure did not finish.
     */
    public boolean isErasurePending() {
        try {
            return store.getBoolean(StoreKeys.ERASURE_PENDING).orElse(false);
        } catch (StoreException e) {
            log.error("Could not read erasure marker: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Completes an interrupted erasure.
     *
     * @return {@code Ok(true)} if one was resumed and finished, {@code Ok(false)} if none was pending
     */
    public Outcome<Boolean> resumePendingErasure() {
        if (!isErasurePending()) {
            return Outcome.ok(false);
        }
        log.warn("Resuming interrupted erasure");
        return eraseEverything().map(ignored -> true);
    }
}
