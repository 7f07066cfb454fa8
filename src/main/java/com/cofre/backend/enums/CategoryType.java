package com.cofre.backend.enums;

public enum CategoryType {
    INCOME,
    EXPENSE
}
