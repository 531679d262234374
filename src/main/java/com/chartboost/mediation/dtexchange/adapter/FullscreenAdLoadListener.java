package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.execution.CompletionBridge;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;

/**
 * Load callbacks for interstitial and rewarded ads. The loaded spot itself is the ad handle.
 */
class FullscreenAdLoadListener extends AbstractAdLoadListener {

    FullscreenAdLoadListener(CompletionBridge<PartnerAd> bridge, AdSpot adSpot, PartnerAdLoadRequest request) {
        super(bridge, adSpot, request);
    }

    @Override
    protected PartnerAd toPartnerAd(AdSpot ad) {
        return PartnerAd.of(ad, request);
    }
}
