package com.chartboost.mediation.dtexchange.adapter;

import com.chartboost.mediation.dtexchange.partner.PartnerAdListener;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Listeners registered by fullscreen loads, keyed by load identifier, until the load fails or the ad is shown or
 * invalidated.
 * <p>
 * Concurrent loads for the same identifier are not supported: the last registration wins.
 */
public class PartnerAdListenerRegistry {

    private final Map<String, PartnerAdListener> listeners = Collections.synchronizedMap(new HashMap<>());

    public void register(String identifier, PartnerAdListener listener) {
        if (identifier != null && listener != null) {
            listeners.put(identifier, listener);
        }
    }

    public PartnerAdListener remove(String identifier) {
        return identifier != null ? listeners.remove(identifier) : null;
    }
}
