package com.chartboost.mediation.dtexchange.exchange;

@FunctionalInterface
public interface InitListener {

    void onInitialized(InitStatus status);
}
