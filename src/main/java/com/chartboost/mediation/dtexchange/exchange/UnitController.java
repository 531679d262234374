package com.chartboost.mediation.dtexchange.exchange;

public interface UnitController {
}
