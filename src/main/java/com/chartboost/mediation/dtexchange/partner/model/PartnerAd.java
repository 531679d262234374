package com.chartboost.mediation.dtexchange.partner.model;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Loaded partner ad handed back to the mediation layer.
 * <p>
 * {@code ad} is an opaque partner object and may be null after a failed or abandoned load.
 */
@AllArgsConstructor(staticName = "of")
@Value
public class PartnerAd {

    Object ad;

    Map<String, String> details;

    PartnerAdLoadRequest request;

    public static PartnerAd of(Object ad, PartnerAdLoadRequest request) {
        return PartnerAd.of(ad, Collections.emptyMap(), request);
    }
}
