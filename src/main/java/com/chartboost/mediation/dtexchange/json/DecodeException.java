package com.chartboost.mediation.dtexchange.json;

@SuppressWarnings("serial")
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
