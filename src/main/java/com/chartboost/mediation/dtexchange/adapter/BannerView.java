package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.exchange.AdSpot;
import com.chartboost.mediation.dtexchange.exchange.AdViewContainer;
import com.chartboost.mediation.dtexchange.partner.model.HostContext;
import lombok.Value;

/**
 * Container the SDK renders a banner into. It is the ad handle returned for banner loads and keeps the spot to
 * destroy on invalidate.
 */
@Value
public class BannerView implements AdViewContainer {

    HostContext context;

    AdSpot spot;
}
