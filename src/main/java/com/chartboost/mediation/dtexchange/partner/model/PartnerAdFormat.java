package com.chartboost.mediation.dtexchange.partner.model;

public enum PartnerAdFormat {

    BANNER,

    INTERSTITIAL,

    REWARDED,

    REWARDED_INTERSTITIAL
}
