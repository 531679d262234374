package com.chartboost.mediation.dtexchange.log;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Writes {@link PartnerAdapterEvent}s to the adapter log.
 * <p>
 * Failure events go out at WARN so they surface in production logs, everything else at INFO.
 */
public class PartnerLogController {

    public static final String PRIVACY_TAG = "[Privacy]";

    private static final String PARTNER_TAG = "[Digital Turbine Exchange]";

    private final Logger logger;

    public PartnerLogController(Logger logger) {
        this.logger = Objects.requireNonNull(logger);
    }

    public static PartnerLogController create(Class<?> clazz) {
        return new PartnerLogController(LoggerFactory.getLogger(clazz));
    }

    public void log(PartnerAdapterEvent event) {
        log(event, null);
    }

    public void log(PartnerAdapterEvent event, String details) {
        final String line = format(event, details);
        if (event.isFailure()) {
            logger.warn(line);
        } else {
            logger.info(line);
        }
    }

    private static String format(PartnerAdapterEvent event, String details) {
        final String eventMessage = event.getMessage();
        if (StringUtils.isBlank(details)) {
            return "%s %s %s".formatted(PARTNER_TAG, event.name(), eventMessage).trim();
        }

        return StringUtils.isEmpty(eventMessage)
                ? "%s %s %s".formatted(PARTNER_TAG, event.name(), details)
                : "%s %s %s %s".formatted(PARTNER_TAG, event.name(), eventMessage, details);
    }
}
