package com.chartboost.mediation.dtexchange.exchange;

public interface BannerUnitController extends UnitController {

    void setEventsListener(BannerEventsListener eventsListener);

    void bindView(AdViewContainer container);
}
