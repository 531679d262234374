package com.chartboost.mediation.dtexchange.partner.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Value;

@AllArgsConstructor(staticName = "of")
@Value
public class PartnerConfiguration {

    ObjectNode credentials;
}
