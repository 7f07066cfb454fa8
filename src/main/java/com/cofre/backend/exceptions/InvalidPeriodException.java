package com.cofre.backend.exceptions;

import java.time.LocalDate;
import java.util.Map;

public class InvalidPeriodException extends BusinessException {

    public InvalidPeriodException(LocalDate startDate, LocalDate endDate) {
        super(ErrorCode.INVALID_PERIOD,
                "Data final deve ser posterior à data inicial",
                Map.of("startDate", startDate, "endDate", endDate));
    }
}
