package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.AdDisplayError;
import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.BannerEventsListener;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;

class BannerAdEventsListener implements BannerEventsListener {

    private static final PartnerLogController partnerLog = PartnerLogController.create(BannerAdEventsListener.class);

    private final PartnerAdLoadRequest request;
    private final PartnerAdListener listener;

    BannerAdEventsListener(PartnerAdLoadRequest request, PartnerAdListener listener) {
        this.request = request;
        this.listener = listener; // can be null
    }

    @Override
    public void onAdImpression(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_TRACK_IMPRESSION);
        PartnerAdListeners.notify(listener, "onPartnerAdImpression",
                l -> l.onPartnerAdImpression(PartnerAd.of(adSpot, request)));
    }

    @Override
    public void onAdClicked(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_CLICK);
        PartnerAdListeners.notify(listener, "onPartnerAdClicked",
                l -> l.onPartnerAdClicked(PartnerAd.of(adSpot, request)));
    }

    @Override
    public void onAdEnteredErrorState(AdSpot adSpot, AdDisplayError error) {
        partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Error: %s".formatted(error));
    }
}
