package com.chartboost.mediation.dtexchange.exchange;

/**
 * Ad request failure codes reported by the exchange SDK.
 */
public enum ExchangeErrorCode {

    NO_FILL,
    CONNECTION_ERROR,
    CONNECTION_TIMEOUT,
    SERVER_INTERNAL_ERROR,
    SERVER_INVALID_RESPONSE,
    LOAD_TIMEOUT,
    IN_FLIGHT_TIMEOUT,
    ERROR_CODE_NATIVE_VIDEO_NOT_SUPPORTED,
    ERROR_CONFIGURATION_MISMATCH,
    ERROR_CONFIGURATION_NO_SUCH_APPID,
    SPOT_DISABLED,
    UNSUPPORTED_SPOT,
    INVALID_INPUT,
    NON_SECURE_CONTENT_DETECTED,
    SDK_INTERNAL_ERROR,
    SDK_NOT_INITIALIZED,
    CANCELLED,
    UNSPECIFIED
}
