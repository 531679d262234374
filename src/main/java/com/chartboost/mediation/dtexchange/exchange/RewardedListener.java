package com.chartboost.mediation.dtexchange.exchange;

@FunctionalInterface
public interface RewardedListener {

    void onAdRewarded(AdSpot adSpot);
}
