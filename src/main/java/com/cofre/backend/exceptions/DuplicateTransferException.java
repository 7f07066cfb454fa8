package com.cofre.backend.exceptions;

import java.util.Map;

public class DuplicateTransferException extends BusinessException {

    public DuplicateTransferException(int month, int year) {
        super(ErrorCode.DUPLICATE_TRANSFER,
                String.format("A sobra do orçamento de %d/%d já foi transferida para a poupança", month, year),
                Map.of("month", month, "year", year));
    }
}
