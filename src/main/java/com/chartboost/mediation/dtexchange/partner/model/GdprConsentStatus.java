package com.chartboost.mediation.dtexchange.partner.model;

public enum GdprConsentStatus {

    GDPR_CONSENT_UNKNOWN,

    GDPR_CONSENT_GRANTED,

    GDPR_CONSENT_DENIED
}
