package com.wingman.core.error;

/**
 * Base type for failures that abort a whole sync.
 */
public abstract class CampaignSyncException extends Exception {

    protected CampaignSyncException(String message) {
        super(message);
    }

    protected CampaignSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
