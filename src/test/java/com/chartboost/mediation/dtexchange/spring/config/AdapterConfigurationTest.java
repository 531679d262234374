package com.chartboost.mediation.dtexchange.spring.config;

import com.chartboost.mediation.dtexchange.adapter.DigitalTurbineExchangeAdapter;
import com.chartboost.mediation.dtexchange.adapter.DigitalTurbineExchangeAdapterConfiguration;
import com.chartboost.mediation.dtexchange.exchange.ExchangeSdk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class AdapterConfigurationTest {

    private ExchangeSdk exchangeSdk;

    private ApplicationContextRunner contextRunner;

    @BeforeEach
    public void setUp() {
        exchangeSdk = mock(ExchangeSdk.class);
        contextRunner = new ApplicationContextRunner()
                .withBean(ExchangeSdk.class, () -> exchangeSdk)
                .withUserConfiguration(AdapterConfiguration.class);
    }

    @Test
    public void shouldRegisterAdapterWithDefaults() {
        contextRunner.run(context -> {
            // then
            assertThat(context).hasSingleBean(DigitalTurbineExchangeAdapter.class);
            final DigitalTurbineExchangeAdapterConfiguration configuration =
                    context.getBean(DigitalTurbineExchangeAdapterConfiguration.class);
            assertThat(configuration.getPartnerId()).isEqualTo("fyber");
            assertThat(configuration.isMuteVideo()).isFalse();
            verify(exchangeSdk).setMuteVideo(false);
            verify(exchangeSdk, never()).setLogLevel(anyInt());
        });
    }

    @Test
    public void shouldApplyConfiguredProperties() {
        contextRunner
                .withPropertyValues(
                        "adapters.digital-turbine-exchange.mute-video=true",
                        "adapters.digital-turbine-exchange.log-level=debug",
                        "adapters.digital-turbine-exchange.version-file="
                                + "com/chartboost/mediation/dtexchange/version/version.json")
                .run(context -> {
                    // then
                    final DigitalTurbineExchangeAdapterConfiguration configuration =
                            context.getBean(DigitalTurbineExchangeAdapterConfiguration.class);
                    assertThat(configuration.isMuteVideo()).isTrue();
                    assertThat(configuration.getAdapterVersion()).isEqualTo("5.8.3.0.0");
                    verify(exchangeSdk).setMuteVideo(true);
                    verify(exchangeSdk).setLogLevel(3);
                });
    }

    @Test
    public void shouldFailOnUnknownLogLevel() {
        contextRunner
                .withPropertyValues("adapters.digital-turbine-exchange.log-level=chatty")
                .run(context -> assertThat(context)
                        .hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(IllegalArgumentException.class));
    }

    @Test
    public void shouldNotRegisterAdapterWhenDisabled() {
        contextRunner
                .withPropertyValues("adapters.digital-turbine-exchange.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(DigitalTurbineExchangeAdapter.class));
    }
}
