package com.cofre.backend.dto.savings;

import java.util.List;

import lombok.Data;

@Data
public class SavingsTransactionPageResponse {
    private List<SavingsTransactionResponse> transactions;

    private int page;
    private int limit;
    private long total;
    private int pages;
    private boolean hasMore;
}
