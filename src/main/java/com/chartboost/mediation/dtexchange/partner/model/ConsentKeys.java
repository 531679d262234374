package com.chartboost.mediation.dtexchange.partner.model;

/**
 * Well-known keys of the consent map propagated by the mediation layer. Partners may also receive a value under
 * their own partner id.
 */
public final class ConsentKeys {

    public static final String GDPR_CONSENT_GIVEN = "gdpr_consent_given";
    public static final String TCF = "tcf";
    public static final String USP = "usp";

    private ConsentKeys() {
    }
}
