package com.chartboost.mediation.dtexchange.exchange;

public interface BannerEventsListener {

    void onAdImpression(AdSpot adSpot);

    void onAdClicked(AdSpot adSpot);

    void onAdEnteredErrorState(AdSpot adSpot, AdDisplayError error);

    default void onAdWillCloseInternalBrowser(AdSpot adSpot) {
    }

    default void onAdWillOpenExternalApp(AdSpot adSpot) {
    }

    default void onAdExpanded(AdSpot adSpot) {
    }

    default void onAdResized(AdSpot adSpot) {
    }

    default void onAdCollapsed(AdSpot adSpot) {
    }
}
