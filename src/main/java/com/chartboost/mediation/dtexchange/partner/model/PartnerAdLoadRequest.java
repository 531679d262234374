package com.chartboost.mediation.dtexchange.partner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Everything the mediation layer knows about a single ad load call.
 */
@Builder(toBuilder = true)
@Value
public class PartnerAdLoadRequest {

    /**
     * Placement identifier on the partner side.
     */
    String partnerPlacement;

    String mediationPlacement;

    PartnerAdFormat format;

    /**
     * Unique identifier of this load call. Listeners are registered under it.
     */
    String identifier;
}
