package com.chartboost.mediation.dtexchange.partner.model;

/**
 * Error classification understood by the mediation layer.
 */
public enum MediationError {

    INITIALIZATION_INVALID_CREDENTIALS(Category.INITIALIZATION,
            "Invalid or missing credentials. Check the partner credentials in the dashboard."),
    INITIALIZATION_UNKNOWN(Category.INITIALIZATION,
            "The partner SDK failed to initialize for an unknown reason."),

    LOAD_NO_FILL(Category.LOAD, "There is no ad inventory at this time."),
    LOAD_SERVER_ERROR(Category.LOAD, "The partner server returned an error."),
    LOAD_INVALID_BID_RESPONSE(Category.LOAD, "The partner server response could not be parsed."),
    LOAD_AD_REQUEST_TIMEOUT(Category.LOAD, "The ad request timed out."),
    LOAD_MISMATCHED_AD_FORMAT(Category.LOAD, "The loaded ad does not match the requested format."),
    LOAD_UNSUPPORTED_AD_FORMAT(Category.LOAD, "The ad format is not supported by the partner."),

    SHOW_AD_NOT_READY(Category.SHOW, "The ad is not ready to be shown."),
    SHOW_WRONG_RESOURCE_TYPE(Category.SHOW, "The stored ad object is of an unexpected type."),
    SHOW_UNSUPPORTED_AD_FORMAT(Category.SHOW, "The ad format is not supported by the partner."),
    SHOW_UNKNOWN(Category.SHOW, "The ad failed to show for an unknown reason."),

    INVALIDATE_AD_NOT_FOUND(Category.INVALIDATE, "There is no ad to invalidate."),
    INVALIDATE_WRONG_RESOURCE_TYPE(Category.INVALIDATE, "The stored ad object is of an unexpected type."),

    OTHER_NO_CONNECTIVITY(Category.OTHER, "No internet connectivity."),
    OTHER_PARTNER_ERROR(Category.OTHER, "The partner SDK returned an error.");

    private final Category category;

    private final String message;

    MediationError(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public enum Category {

        INITIALIZATION,

        LOAD,

        SHOW,

        INVALIDATE,

        OTHER
    }
}
