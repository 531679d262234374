package com.chartboost.mediation.dtexchange.exchange;

public interface FullscreenEventsListener {

    void onAdImpression(AdSpot adSpot);

    void onAdClicked(AdSpot adSpot);

    void onAdEnteredErrorState(AdSpot adSpot, AdDisplayError error);

    void onAdDismissed(AdSpot adSpot);

    default void onAdWillCloseInternalBrowser(AdSpot adSpot) {
    }

    default void onAdWillOpenExternalApp(AdSpot adSpot) {
    }
}
