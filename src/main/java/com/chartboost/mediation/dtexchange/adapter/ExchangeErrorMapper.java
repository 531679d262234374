package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.ExchangeErrorCode;
import com.chartboost.mediation.dtexchange.exchange.InitStatus;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;

/**
 * Translates exchange SDK failure signals into {@link MediationError}s.
 */
public class ExchangeErrorMapper {

    private ExchangeErrorMapper() {
    }

    public static MediationError toMediationError(ExchangeErrorCode errorCode) {
        if (errorCode == null) {
            return MediationError.OTHER_PARTNER_ERROR;
        }

        return switch (errorCode) {
            case NO_FILL -> MediationError.LOAD_NO_FILL;
            case CONNECTION_ERROR -> MediationError.OTHER_NO_CONNECTIVITY;
            case SERVER_INTERNAL_ERROR -> MediationError.LOAD_SERVER_ERROR;
            case SERVER_INVALID_RESPONSE -> MediationError.LOAD_INVALID_BID_RESPONSE;
            case LOAD_TIMEOUT -> MediationError.LOAD_AD_REQUEST_TIMEOUT;
            case ERROR_CODE_NATIVE_VIDEO_NOT_SUPPORTED -> MediationError.LOAD_MISMATCHED_AD_FORMAT;
            default -> MediationError.OTHER_PARTNER_ERROR;
        };
    }

    /**
     * @return null when the status counts as a successful setup
     */
    public static MediationError toMediationError(InitStatus status) {
        if (status == null) {
            return MediationError.INITIALIZATION_UNKNOWN;
        }

        return switch (status) {
            // a failed init is retried by the SDK on the first ad request
            case SUCCESSFULLY, FAILED -> null;
            case FAILED_NO_KITS_DETECTED -> MediationError.INITIALIZATION_UNKNOWN;
            case INVALID_APP_ID -> MediationError.INITIALIZATION_INVALID_CREDENTIALS;
        };
    }
}
