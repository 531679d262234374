package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.log.PartnerAdapterEvent;
import com.chartboost.mediation.dtexchange.log.PartnerLogController;
import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;

import java.util.function.Consumer;

final class PartnerAdListeners {

    private static final PartnerLogController partnerLog = PartnerLogController.create(PartnerAdListeners.class);

    private PartnerAdListeners() {
    }

    /**
     * Fires {@code callback} on {@code listener}. A null listener only produces a log line.
     */
    static void notify(PartnerAdListener listener, String callbackName, Consumer<PartnerAdListener> callback) {
        if (listener == null) {
            partnerLog.log(PartnerAdapterEvent.CUSTOM,
                    "Unable to fire %s for Digital Turbine Exchange adapter. Listener is null.".formatted(callbackName));
            return;
        }

        callback.accept(listener);
    }
}
