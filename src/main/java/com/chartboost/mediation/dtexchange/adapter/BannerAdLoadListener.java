package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.BannerUnitController;
import com.chartboost.mediation.dtexchange.execution.CompletionBridge;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;
import com.chartboost.mediation.dtexchange.partner.model.HostContext;
import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;

/**
 * Load callbacks for banners. A served banner is bound to a {@link BannerView}, which becomes the ad handle.
 */
class BannerAdLoadListener extends AbstractAdLoadListener {

    private static final PartnerLogController partnerLog = PartnerLogController.create(BannerAdLoadListener.class);

    private final HostContext context;
    private final PartnerAdListener listener;

    BannerAdLoadListener(CompletionBridge<PartnerAd> bridge,
                         AdSpot adSpot,
                         PartnerAdLoadRequest request,
                         HostContext context,
                         PartnerAdListener listener) {

        super(bridge, adSpot, request);
        this.context = context;
        this.listener = listener;
    }

    @Override
    protected PartnerAd toPartnerAd(AdSpot ad) {
        if (ad != adSpot) {
            partnerLog.log(PartnerAdapterEvent.LOAD_FAILED,
                    "Digital Turbine Exchange returned an ad for a different ad spot: %s.".formatted(ad));
            throw new MediationAdException(MediationError.LOAD_MISMATCHED_AD_FORMAT);
        }

        if (!(ad.getSelectedUnitController() instanceof BannerUnitController controller)) {
            partnerLog.log(PartnerAdapterEvent.LOAD_FAILED, "Selected unit controller is not a banner controller.");
            throw new MediationAdException(MediationError.LOAD_MISMATCHED_AD_FORMAT);
        }

        final BannerView bannerView = new BannerView(context, adSpot);
        controller.setEventsListener(new BannerAdEventsListener(request, listener));
        controller.bindView(bannerView);

        return PartnerAd.of(bannerView, request);
    }
}
