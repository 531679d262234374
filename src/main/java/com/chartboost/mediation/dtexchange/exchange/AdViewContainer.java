package com.chartboost.mediation.dtexchange.exchange;

/**
 * View the SDK renders a banner into.
 */
public interface AdViewContainer {

    AdSpot getSpot();
}
