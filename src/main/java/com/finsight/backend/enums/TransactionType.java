package com.finsight.backend.enums;

public enum TransactionType {
    INCOME,
    EXPENSE,
    INVESTMENT
}
