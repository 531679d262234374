package com.chartboost.mediation.dtexchange.spring.config;

import com.chartboost.mediation.dtexchange.adapter.DigitalTurbineExchangeAdapter;
import com.chartboost.mediation.dtexchange.adapter.DigitalTurbineExchangeAdapterConfiguration;
import com.chartboost.mediation.dtexchange.exchange.ExchangeLogLevel;
import com.chartboost.mediation.dtexchange.exchange.ExchangeSdk;
import com.chartboost.mediation.dtexchange.json.JacksonMapper;
import com.chartboost.mediation.dtexchange.json.ObjectMapperProvider;
import com.chartboost.mediation.dtexchange.log.Logger;
import com.chartboost.mediation.dtexchange.log.LoggerFactory;
import com.chartboost.mediation.dtexchange.version.VersionInfo;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Digital Turbine Exchange adapter. The host application provides the {@link ExchangeSdk} bean bound to
 * the real network SDK.
 */
@Configuration
@ConditionalOnProperty(prefix = "adapters.digital-turbine-exchange", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class AdapterConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AdapterConfiguration.class);

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    VersionInfo adapterVersionInfo(
            @Value("${adapters.digital-turbine-exchange.version-file:dtexchange-adapter-version.json}")
            String versionFile,
            JacksonMapper jacksonMapper) {

        return VersionInfo.create(versionFile, jacksonMapper);
    }

    @Bean
    DigitalTurbineExchangeAdapterConfiguration digitalTurbineExchangeAdapterConfiguration(
            ExchangeSdk exchangeSdk,
            VersionInfo adapterVersionInfo,
            @Value("${adapters.digital-turbine-exchange.mute-video:false}") boolean muteVideo,
            @Value("${adapters.digital-turbine-exchange.log-level:}") String logLevel) {

        final DigitalTurbineExchangeAdapterConfiguration configuration =
                new DigitalTurbineExchangeAdapterConfiguration(exchangeSdk, adapterVersionInfo);

        configuration.setMuteVideo(muteVideo);
        if (StringUtils.isNotBlank(logLevel)) {
            configuration.setLogLevel(parseLogLevel(logLevel));
        }

        return configuration;
    }

    private static int parseLogLevel(String logLevel) {
        try {
            return ExchangeLogLevel.valueOf(logLevel.trim().toUpperCase()).getPriority();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid adapters.digital-turbine-exchange.log-level: %s".formatted(logLevel), e);
        }
    }

    @Bean
    DigitalTurbineExchangeAdapter digitalTurbineExchangeAdapter(
            ExchangeSdk exchangeSdk,
            DigitalTurbineExchangeAdapterConfiguration digitalTurbineExchangeAdapterConfiguration,
            JacksonMapper jacksonMapper,
            @Value("${adapters.digital-turbine-exchange.mediator-name:Chartboost}") String mediatorName,
            @Value("${adapters.digital-turbine-exchange.mediation-version:undefined}") String mediationVersion) {

        logger.info("Digital Turbine Exchange adapter {0} configured for mediator {1} {2}",
                digitalTurbineExchangeAdapterConfiguration.getAdapterVersion(), mediatorName, mediationVersion);

        return new DigitalTurbineExchangeAdapter(
                exchangeSdk,
                digitalTurbineExchangeAdapterConfiguration,
                jacksonMapper,
                mediatorName,
                mediationVersion);
    }
}
