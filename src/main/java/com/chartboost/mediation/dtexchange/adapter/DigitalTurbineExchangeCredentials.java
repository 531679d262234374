package com.chartboost.mediation.dtexchange.adapter;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Credentials object of the partner configuration, bound with snake_case names.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class DigitalTurbineExchangeCredentials {

    private String fyberAppId;
}
