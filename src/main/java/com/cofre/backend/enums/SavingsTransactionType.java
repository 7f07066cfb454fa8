package com.cofre.backend.enums;

public enum SavingsTransactionType {
    CREDIT,
    DEBIT
}
