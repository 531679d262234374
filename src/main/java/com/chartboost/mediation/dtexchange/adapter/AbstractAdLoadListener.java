package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.ExchangeErrorCode;
import com.chartboost.mediation.dtexchange.exchange.RequestListener;
import com.chartboost.mediation.dtexchange.execution.CompletionBridge;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;

import java.util.Objects;

/**
 * Bridges the ad request callbacks of one {@link AdSpot} into the pending load.
 * <p>
 * Repeated callbacks are dropped. A callback that arrives after the load was abandoned only releases the spot.
 */
abstract class AbstractAdLoadListener implements RequestListener {

    private static final PartnerLogController partnerLog = PartnerLogController.create(AbstractAdLoadListener.class);

    protected final CompletionBridge<PartnerAd> bridge;
    protected final AdSpot adSpot;
    protected final PartnerAdLoadRequest request;

    protected AbstractAdLoadListener(CompletionBridge<PartnerAd> bridge, AdSpot adSpot, PartnerAdLoadRequest request) {
        this.bridge = Objects.requireNonNull(bridge);
        this.adSpot = Objects.requireNonNull(adSpot);
        this.request = Objects.requireNonNull(request);
    }

    @Override
    public final void onSuccessfulAdRequest(AdSpot ad) {
        if (!bridge.isPending()) {
            releaseIfCancelled();
            return;
        }

        final PartnerAd partnerAd;
        try {
            partnerAd = toPartnerAd(ad);
        } catch (MediationAdException e) {
            settle(bridge.fail(e));
            return;
        }

        partnerLog.log(PartnerAdapterEvent.LOAD_SUCCEEDED);
        settle(bridge.complete(partnerAd));
    }

    @Override
    public final void onFailedAdRequest(AdSpot ad, ExchangeErrorCode errorCode) {
        if (!bridge.isPending()) {
            releaseIfCancelled();
            return;
        }

        partnerLog.log(PartnerAdapterEvent.LOAD_FAILED, "Ad spot %s. Error code: %s".formatted(ad, errorCode));
        settle(bridge.fail(new MediationAdException(ExchangeErrorMapper.toMediationError(errorCode))));
    }

    /**
     * Turns the loaded spot into the ad handed to the mediation layer.
     *
     * @throws MediationAdException if the served ad cannot be used
     */
    protected abstract PartnerAd toPartnerAd(AdSpot ad);

    private void settle(CompletionBridge.Resolution resolution) {
        if (resolution == CompletionBridge.Resolution.ABANDONED) {
            release();
        }
    }

    private void releaseIfCancelled() {
        if (bridge.getState() == CompletionBridge.State.CANCELLED) {
            release();
        }
    }

    private void release() {
        partnerLog.log(PartnerAdapterEvent.CUSTOM,
                "Load %s was abandoned, destroying ad spot.".formatted(request.getIdentifier()));
        adSpot.destroy();
    }
}
