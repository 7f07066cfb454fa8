package com.cofre.backend.enums;

public enum TransactionType {
    INCOME,
    EXPENSE
}
