package com.chartboost.mediation.dtexchange.partner.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@AllArgsConstructor(staticName = "of")
@Value
public class PartnerAdPreBidRequest {

    String mediationPlacement;

    PartnerAdFormat format;
}
