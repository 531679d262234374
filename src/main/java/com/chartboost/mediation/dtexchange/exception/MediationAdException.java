package com.chartboost.mediation.dtexchange.exception;

import com.chartboost.mediation.dtexchange.partner.model.MediationError;
import lombok.Getter;

import java.util.Objects;

@Getter
@SuppressWarnings("serial")
public class MediationAdException extends RuntimeException {

    private final MediationError error;

    public MediationAdException(MediationError error) {
        super(Objects.requireNonNull(error).name() + ": " + error.getMessage());
        this.error = error;
    }

    public MediationAdException(MediationError error, Throwable cause) {
        super(Objects.requireNonNull(error).name() + ": " + error.getMessage(), cause);
        this.error = error;
    }
}
