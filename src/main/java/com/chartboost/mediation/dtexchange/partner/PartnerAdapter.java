package com.chartboost.mediation.dtexchange.partner;

import com.chartboost.mediation.dtexchange.partner.model.GdprConsentStatus;
import com.chartboost.mediation.dtexchange.partner.model.HostActivity;
import com.chartboost.mediation.dtexchange.partner.model.HostContext;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAd;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdLoadRequest;
import com.chartboost.mediation.dtexchange.partner.model.PartnerAdPreBidRequest;
import com.chartboost.mediation.dtexchange.partner.model.PartnerConfiguration;
import io.vertx.core.Future;

import java.util.Map;
import java.util.Set;

/**
 * Defines the contract the mediation layer uses to drive a single ad network.
 * <p>
 * Asynchronous operations never throw: a failure is reported as a failed {@link Future} whose cause is a
 * {@link com.chartboost.mediation.dtexchange.exception.MediationAdException}.
 */
public interface PartnerAdapter {

    PartnerAdapterConfiguration getConfiguration();

    /**
     * Initializes the partner SDK so that it is ready to request ads.
     */
    Future<Map<String, Object>> setUp(HostContext context, PartnerConfiguration partnerConfiguration);

    /**
     * Propagates the current consent map. {@code modifiedKeys} names the entries changed since the previous call.
     */
    void setConsents(HostContext context, Map<String, String> consents, Set<String> modifiedKeys);

    void setIsUserUnderage(HostContext context, boolean isUserUnderage);

    void setGdprApplies(HostContext context, boolean gdprApplies);

    void setGdprConsentStatus(HostContext context, GdprConsentStatus gdprConsentStatus);

    void setCcpaConsent(HostContext context, boolean hasGivenCcpaConsent, String privacyString);

    /**
     * Collects bidding tokens for a network bidding request.
     */
    Future<Map<String, String>> fetchBidderInformation(HostContext context, PartnerAdPreBidRequest request);

    Future<PartnerAd> load(HostContext context, PartnerAdLoadRequest request, PartnerAdListener partnerAdListener);

    Future<PartnerAd> show(HostActivity activity, PartnerAd partnerAd);

    /**
     * Discards the ad and releases its resources.
     */
    Future<PartnerAd> invalidate(PartnerAd partnerAd);
}
