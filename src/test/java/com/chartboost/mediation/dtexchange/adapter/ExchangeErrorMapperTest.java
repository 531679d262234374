package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.ExchangeErrorCode;
import com.chartboost.mediation.dtexchange.exchange.InitStatus;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

public class ExchangeErrorMapperTest {

    @Test
    public void toMediationErrorShouldMapKnownErrorCodes() {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.NO_FILL))
                .isEqualTo(MediationError.LOAD_NO_FILL);
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.CONNECTION_ERROR))
                .isEqualTo(MediationError.OTHER_NO_CONNECTIVITY);
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.SERVER_INTERNAL_ERROR))
                .isEqualTo(MediationError.LOAD_SERVER_ERROR);
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.SERVER_INVALID_RESPONSE))
                .isEqualTo(MediationError.LOAD_INVALID_BID_RESPONSE);
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.LOAD_TIMEOUT))
                .isEqualTo(MediationError.LOAD_AD_REQUEST_TIMEOUT);
        assertThat(ExchangeErrorMapper.toMediationError(ExchangeErrorCode.ERROR_CODE_NATIVE_VIDEO_NOT_SUPPORTED))
                .isEqualTo(MediationError.LOAD_MISMATCHED_AD_FORMAT);
    }

    @ParameterizedTest
    @EnumSource(value = ExchangeErrorCode.class, mode = EnumSource.Mode.EXCLUDE, names = {
            "NO_FILL",
            "CONNECTION_ERROR",
            "SERVER_INTERNAL_ERROR",
            "SERVER_INVALID_RESPONSE",
            "LOAD_TIMEOUT",
            "ERROR_CODE_NATIVE_VIDEO_NOT_SUPPORTED"})
    public void toMediationErrorShouldFallBackToPartnerErrorForOtherCodes(ExchangeErrorCode errorCode) {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError(errorCode)).isEqualTo(MediationError.OTHER_PARTNER_ERROR);
    }

    @Test
    public void toMediationErrorShouldReturnPartnerErrorForNullCode() {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError((ExchangeErrorCode) null))
                .isEqualTo(MediationError.OTHER_PARTNER_ERROR);
    }

    @ParameterizedTest
    @EnumSource(ExchangeErrorCode.class)
    public void toMediationErrorShouldBeDeterministic(ExchangeErrorCode errorCode) {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError(errorCode))
                .isNotNull()
                .isEqualTo(ExchangeErrorMapper.toMediationError(errorCode));
    }

    @Test
    public void toMediationErrorShouldTreatSuccessfulAndRecoverableInitAsSuccess() {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError(InitStatus.SUCCESSFULLY)).isNull();
        assertThat(ExchangeErrorMapper.toMediationError(InitStatus.FAILED)).isNull();
    }

    @Test
    public void toMediationErrorShouldMapInitFailures() {
        // when and then
        assertThat(ExchangeErrorMapper.toMediationError(InitStatus.FAILED_NO_KITS_DETECTED))
                .isEqualTo(MediationError.INITIALIZATION_UNKNOWN);
        assertThat(ExchangeErrorMapper.toMediationError(InitStatus.INVALID_APP_ID))
                .isEqualTo(MediationError.INITIALIZATION_INVALID_CREDENTIALS);
        assertThat(ExchangeErrorMapper.toMediationError((InitStatus) null))
                .isEqualTo(MediationError.INITIALIZATION_UNKNOWN);
    }
}
