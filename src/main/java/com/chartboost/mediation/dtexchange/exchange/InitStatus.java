package com.chartboost.mediation.dtexchange.exchange;

public enum InitStatus {

    SUCCESSFULLY,

    /**
     * Recoverable, the SDK retries initialization on the first ad request.
     */
    FAILED,

    FAILED_NO_KITS_DETECTED,

    INVALID_APP_ID
}
