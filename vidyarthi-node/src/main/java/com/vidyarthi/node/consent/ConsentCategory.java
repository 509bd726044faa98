package com.vidyarthi.node.consent;

import com.vidyarthi.node.store.StoreKeys;

/**
 * Individually grantable consent categories and the store slot each one lives in.
 */
public enum ConsentCategory {
    DATA_PROCESSING(StoreKeys.DATA_PROCESSING_CONSENT),
    ANALYTICS(StoreKeys.ANALYTICS_CONSENT),
    MARKETING(StoreKeys.MARKETING_CONSENT),
    THIRD_PARTY_SHARING(StoreKeys.THIRD_PARTY_CONSENT);

    private final String storeKey;

    ConsentCategory(String storeKey) {
        this.storeKey = storeKey;
    }

    public String storeKey() {
        return storeKey;
    }
}
