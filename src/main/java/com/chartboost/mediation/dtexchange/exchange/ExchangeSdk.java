package com.chartboost.mediation.dtexchange.exchange;

import com.chartboost.mediation.dtexchange.partner.model.HostContext;

/**
 * Port to the Digital Turbine Exchange (Fyber Marketplace) SDK. The host application binds it to the real SDK.
 */
public interface ExchangeSdk {

    String getVersion();

    /**
     * Starts SDK initialization. {@code listener} is called on an SDK thread once initialization finished.
     */
    void initialize(HostContext context, String appId, InitListener listener);

    void setGdprConsent(boolean consentGiven);

    void setGdprConsentString(String consentString);

    void clearGdprConsentData();

    void setUsPrivacyString(String privacyString);

    void setMuteVideo(boolean mute);

    /**
     * @param level platform log priority, see {@link ExchangeLogLevel}
     */
    void setLogLevel(int level);

    AdSpot createSpot();

    BannerUnitController createBannerUnitController();

    /**
     * Creates a fullscreen unit controller with video content support attached.
     */
    FullscreenUnitController createFullscreenUnitController();
}
