package com.vidyarthi.node.consent;

import java.util.EnumSet;
import java.util.Set;

/**
 * The four consent grants a user can give.
 */
public record ConsentGrants(
        boolean dataProcessing,
        boolean analytics,
        boolean marketing,
        boolean thirdPartySharing
) {

    public static ConsentGrants none() {
        return new ConsentGrants(false, false, false, false);
    }

    /**
     * Data processing and analytics only, the usual first-run choice.
     */
    public static ConsentGrants of(boolean dataProcessing, boolean analytics) {
        return new ConsentGrants(dataProcessing, analytics, false, false);
    }

    public boolean isGranted(ConsentCategory category) {
        return switch (category) {
            case DATA_PROCESSING -> dataProcessing;
            case ANALYTICS -> analytics;
            case MARKETING -> marketing;
            case THIRD_PARTY_SHARING -> thirdPartySharing;
        };
    }

    public Set<ConsentCategory> granted() {
        Set<ConsentCategory> granted = EnumSet.noneOf(ConsentCategory.class);
        for (ConsentCategory category : ConsentCategory.values()) {
            if (isGranted(category)) {
                granted.add(category);
            }
        }
        return granted;
    }
}
