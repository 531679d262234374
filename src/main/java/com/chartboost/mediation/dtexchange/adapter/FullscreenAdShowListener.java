package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.exchange.AdDisplayError;
import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.FullscreenEventsListener;
import com.chartboost.mediation.dtexchange.exchange.RewardedListener;
import com.chartboost.mediation.dtexchange.execution.CompletionBridge;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;

import java.util.Objects;

/**
 * Presentation callbacks of an interstitial or rewarded ad.
 * <p>
 * The pending show resolves on the first impression or display error. Later events are forwarded to the
 * mediation listener only; a missing listener is logged and the event dropped.
 */
class FullscreenAdShowListener implements FullscreenEventsListener, RewardedListener {

    private static final PartnerLogController partnerLog =
            PartnerLogController.create(FullscreenAdShowListener.class);

    private final CompletionBridge<PartnerAd> bridge;
    private final PartnerAdListener listener;
    private final PartnerAd partnerAd;

    FullscreenAdShowListener(CompletionBridge<PartnerAd> bridge, PartnerAdListener listener, PartnerAd partnerAd) {
        this.bridge = Objects.requireNonNull(bridge);
        this.listener = listener; // can be null
        this.partnerAd = Objects.requireNonNull(partnerAd);
    }

    @Override
    public void onAdImpression(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_TRACK_IMPRESSION);
        final PartnerAd shownAd = PartnerAd.of(adSpot, partnerAd.getRequest());
        PartnerAdListeners.notify(listener, "onPartnerAdImpression", l -> l.onPartnerAdImpression(shownAd));

        if (bridge.complete(shownAd) == CompletionBridge.Resolution.DELIVERED) {
            partnerLog.log(PartnerAdapterEvent.SHOW_SUCCEEDED);
        }
    }

    @Override
    public void onAdClicked(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_CLICK);
        PartnerAdListeners.notify(listener, "onPartnerAdClicked",
                l -> l.onPartnerAdClicked(PartnerAd.of(adSpot, partnerAd.getRequest())));
    }

    @Override
    public void onAdEnteredErrorState(AdSpot adSpot, AdDisplayError error) {
        partnerLog.log(PartnerAdapterEvent.SHOW_FAILED, "Error: %s".formatted(error));
        bridge.fail(new MediationAdException(MediationError.SHOW_UNKNOWN));

        adSpot.destroy();
    }

    @Override
    public void onAdDismissed(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_DISMISS);
        PartnerAdListeners.notify(listener, "onPartnerAdDismissed",
                l -> l.onPartnerAdDismissed(PartnerAd.of(adSpot, partnerAd.getRequest()), null));

        adSpot.destroy();
    }

    @Override
    public void onAdRewarded(AdSpot adSpot) {
        partnerLog.log(PartnerAdapterEvent.DID_REWARD);
        PartnerAdListeners.notify(listener, "onPartnerAdRewarded", l -> l.onPartnerAdRewarded(partnerAd));
    }
}
