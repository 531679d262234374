package com.chartboost.mediation.dtexchange.exchange;

/**
 * Outcome of {@link AdSpot#requestAd(AdRequest)}. The SDK has been seen calling it more than once per request.
 */
public interface RequestListener {

    void onSuccessfulAdRequest(AdSpot adSpot);

    void onFailedAdRequest(AdSpot adSpot, ExchangeErrorCode errorCode);
}
