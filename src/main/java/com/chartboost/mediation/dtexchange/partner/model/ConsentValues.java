package com.chartboost.mediation.dtexchange.partner.model;

public final class ConsentValues {

    public static final String GRANTED = "granted";
    public static final String DENIED = "denied";
    public static final String DOES_NOT_APPLY = "does_not_apply";

    private ConsentValues() {
    }
}
