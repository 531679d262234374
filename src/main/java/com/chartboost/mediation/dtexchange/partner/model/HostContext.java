package com.chartboost.mediation.dtexchange.partner.model;

/**
 * Opaque handle to the host application environment, passed through to the network SDK untouched.
 */
public interface HostContext {
}
