package com.chartboost.mediation.dtexchange.log;

/**
 * Lifecycle events reported by a partner adapter to the mediation log.
 */
public enum PartnerAdapterEvent {

    SETUP_STARTED("Setup started."),
    SETUP_SUCCEEDED("Setup succeeded."),
    SETUP_FAILED("Setup failed.", true),

    BIDDER_INFO_FETCH_STARTED("Bidder info fetch started."),
    BIDDER_INFO_FETCH_SUCCEEDED("Bidder info fetch succeeded."),

    LOAD_STARTED("Load started."),
    LOAD_SUCCEEDED("Load succeeded."),
    LOAD_FAILED("Load failed.", true),

    SHOW_STARTED("Show started."),
    SHOW_SUCCEEDED("Show succeeded."),
    SHOW_FAILED("Show failed.", true),

    INVALIDATE_STARTED("Invalidate started."),
    INVALIDATE_SUCCEEDED("Invalidate succeeded."),
    INVALIDATE_FAILED("Invalidate failed.", true),

    DID_TRACK_IMPRESSION("Impression tracked."),
    DID_CLICK("Ad clicked."),
    DID_REWARD("User rewarded."),
    DID_DISMISS("Ad dismissed."),

    USER_IS_UNDERAGE("User is underage."),
    USER_IS_NOT_UNDERAGE("User is not underage."),

    GDPR_CONSENT_GRANTED("GDPR consent granted."),
    GDPR_CONSENT_DENIED("GDPR consent denied."),
    GDPR_CONSENT_UNKNOWN("GDPR consent unknown."),
    GDPR_NOT_APPLICABLE("GDPR does not apply."),

    CUSTOM("");

    private final String message;

    private final boolean failure;

    PartnerAdapterEvent(String message) {
        this(message, false);
    }

    PartnerAdapterEvent(String message, boolean failure) {
        this.message = message;
        this.failure = failure;
    }

    public String getMessage() {
        return message;
    }

    public boolean isFailure() {
        return failure;
    }
}
