package com.chartboost.mediation.dtexchange.partner;

/**
 * Static description of a partner adapter.
 */
public interface PartnerAdapterConfiguration {

    /**
     * Partner name for internal uses.
     */
    String getPartnerId();

    /**
     * Partner name for external uses.
     */
    String getPartnerDisplayName();

    String getPartnerSdkVersion();

    /**
     * Adapter version in the {@code Mediation.Partner.Adapter} format, e.g. {@code 5.8.3.0.0}.
     */
    String getAdapterVersion();
}
