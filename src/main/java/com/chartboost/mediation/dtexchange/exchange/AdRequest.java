package com.chartboost.mediation.dtexchange.exchange;

import lombok.AllArgsConstructor;
import lombok.Value;

@AllArgsConstructor(staticName = "of")
@Value
public class AdRequest {

    String spotId;
}
