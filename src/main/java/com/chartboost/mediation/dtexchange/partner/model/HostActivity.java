package com.chartboost.mediation.dtexchange.partner.model;

/**
 * Host screen that fullscreen ads are presented over.
 */
public interface HostActivity extends HostContext {
}
