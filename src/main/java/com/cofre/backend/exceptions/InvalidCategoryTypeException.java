package com.cofre.backend.exceptions;

import java.util.Map;
import java.util.UUID;

public class InvalidCategoryTypeException extends BusinessException {

    public InvalidCategoryTypeException(UUID categoryId) {
        super(ErrorCode.INVALID_CATEGORY_TYPE,
                "Orçamentos só podem ser definidos para categorias de despesa",
                Map.of("categoryId", categoryId));
    }
}
