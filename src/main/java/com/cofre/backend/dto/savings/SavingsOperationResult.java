package com.cofre.backend.dto.savings;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Estado da poupança após a movimentação + o registro de auditoria criado. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SavingsOperationResult {
    private SavingsResponse savings;
    private SavingsTransactionResponse transaction;
}
