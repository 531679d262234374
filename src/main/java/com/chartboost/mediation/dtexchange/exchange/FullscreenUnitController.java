package com.chartboost.mediation.dtexchange.exchange;

import com.chartboost.mediation.dtexchange.partner.model.HostActivity;

public interface FullscreenUnitController extends UnitController {

    void setEventsListener(FullscreenEventsListener eventsListener);

    void setRewardedListener(RewardedListener rewardedListener);

    void show(HostActivity activity);
}
