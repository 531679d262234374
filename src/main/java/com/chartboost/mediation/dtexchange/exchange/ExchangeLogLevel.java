package com.chartboost.mediation.dtexchange.exchange;

import java.util.Arrays;

/**
 * Platform log priorities accepted by {@link ExchangeSdk#setLogLevel(int)}.
 */
public enum ExchangeLogLevel {

    VERBOSE(2),
    DEBUG(3),
    INFO(4),
    WARN(5),
    ERROR(6),
    ASSERT(7);

    private final int priority;

    ExchangeLogLevel(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * @return the level name, or {@code UNKNOWN} for a priority outside the platform range
     */
    public static String nameOf(int priority) {
        return Arrays.stream(values())
                .filter(level -> level.priority == priority)
                .map(Enum::name)
                .findFirst()
                .orElse("UNKNOWN");
    }
}
