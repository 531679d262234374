package com.chartboost.mediation.dtexchange.exchange;

/**
 * A single ad request slot of the exchange SDK. Once loaded it is also the fullscreen ad object.
 */
public interface AdSpot {

    void addUnitController(UnitController unitController);

    void setMediationName(String mediationName);

    void setMediationVersion(String mediationVersion);

    void setRequestListener(RequestListener requestListener);

    void requestAd(AdRequest adRequest);

    /**
     * Unit controller chosen for the served ad, null before a successful request.
     */
    UnitController getSelectedUnitController();

    boolean isReady();

    void destroy();
}
