package com.chartboost.mediation.dtexchange.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void error(Object message, Object... params) {
        log(Level.ERROR, message.toString(), params);
    }

    public void warn(Object message) {
        log(Level.WARN, message);
    }

    public void info(Object message) {
        log(Level.INFO, message);
    }

    public void info(Object message, Object... params) {
        log(Level.INFO, message.toString(), params);
    }

    public void debug(Object message, Object... params) {
        log(Level.DEBUG, message.toString(), params);
    }

    private void log(Level level, Object message) {
        delegate.logIfEnabled(FQCN, level, null, message, null);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, new FormattedMessage(message, params), null);
    }
}
