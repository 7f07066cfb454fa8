package com.cofre.backend.exceptions;

import java.math.BigDecimal;
import java.util.Map;

public class NothingToTransferException extends BusinessException {

    public NothingToTransferException(BigDecimal budgeted, BigDecimal spent, BigDecimal remaining) {
        super(ErrorCode.NOTHING_TO_TRANSFER,
                "Não há sobra para transferir. O orçamento foi totalmente gasto ou estourado.",
                Map.of("budgeted", budgeted, "spent", spent, "remaining", remaining));
    }
}
