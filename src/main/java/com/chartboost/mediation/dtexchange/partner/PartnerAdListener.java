package com.chartboost.mediation.dtexchange.partner;

import com.chartboost.mediation.dtexchange.exception.MediationAdException;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;

/**
 * Receives ad lifecycle events for a loaded ad. Events may arrive on any thread, independently of the
 * load or show call that registered the listener.
 */
public interface PartnerAdListener {

    void onPartnerAdImpression(PartnerAd partnerAd);

    void onPartnerAdClicked(PartnerAd partnerAd);

    void onPartnerAdRewarded(PartnerAd partnerAd);

    /**
     * @param error cause of an abnormal dismissal, null for a regular one
     */
    void onPartnerAdDismissed(PartnerAd partnerAd, MediationAdException error);
}
