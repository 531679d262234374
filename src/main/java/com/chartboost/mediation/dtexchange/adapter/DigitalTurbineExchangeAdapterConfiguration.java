package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.ExchangeLogLevel;
import com.chartboost.mediation.dtexchange.exchange.ExchangeSdk;
import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdapterConfiguration;
import com.chartboost.mediation.dtexchange.version.VersionInfo;

import java.util.Objects;

public class DigitalTurbineExchangeAdapterConfiguration implements PartnerAdapterConfiguration {

    private static final PartnerLogController partnerLog =
            PartnerLogController.create(DigitalTurbineExchangeAdapterConfiguration.class);

    private static final String PARTNER_ID = "fyber";
    private static final String PARTNER_DISPLAY_NAME = "Digital Turbine Exchange";

    private final ExchangeSdk exchangeSdk;
    private final VersionInfo versionInfo;

    private volatile boolean muteVideo;

    public DigitalTurbineExchangeAdapterConfiguration(ExchangeSdk exchangeSdk, VersionInfo versionInfo) {
        this.exchangeSdk = Objects.requireNonNull(exchangeSdk);
        this.versionInfo = Objects.requireNonNull(versionInfo);
    }

    @Override
    public String getPartnerId() {
        return PARTNER_ID;
    }

    @Override
    public String getPartnerDisplayName() {
        return PARTNER_DISPLAY_NAME;
    }

    @Override
    public String getPartnerSdkVersion() {
        return exchangeSdk.getVersion();
    }

    @Override
    public String getAdapterVersion() {
        return versionInfo.getAdapterVersion();
    }

    public boolean isMuteVideo() {
        return muteVideo;
    }

    /**
     * Mutes or unmutes video creatives served by Digital Turbine Exchange.
     */
    public void setMuteVideo(boolean muteVideo) {
        this.muteVideo = muteVideo;
        exchangeSdk.setMuteVideo(muteVideo);
        partnerLog.log(PartnerAdapterEvent.CUSTOM, "Digital Turbine Exchange video creatives will be %s."
                .formatted(muteVideo ? "muted" : "unmuted"));
    }

    /**
     * Sets the SDK log level.
     *
     * @param level platform log priority, one of {@link ExchangeLogLevel}
     */
    public void setLogLevel(int level) {
        exchangeSdk.setLogLevel(level);
        partnerLog.log(PartnerAdapterEvent.CUSTOM, "Digital Turbine Exchange log level set to %s."
                .formatted(ExchangeLogLevel.nameOf(level)));
    }
}
