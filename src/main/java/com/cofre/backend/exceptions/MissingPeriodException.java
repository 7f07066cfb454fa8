package com.cofre.backend.exceptions;

public class MissingPeriodException extends BusinessException {

    public MissingPeriodException() {
        super(ErrorCode.MISSING_PERIOD, "Informe startDate e endDate ou month e year");
    }
}
