package com.licenseguard.api.abuse;

/**
 * What an abuse enforcer does once its threshold is breached. Either way, the breach is recorded
 * as a risk event.
 */
public enum EnforcementMode {

    /**
     * Reject the operation.
     */
    BLOCK,

    /**
     * Let the operation proceed. The breach is only recorded.
     */
    DETECT;

    public boolean isBlocking() {
        return this == BLOCK;
    }
}
