package com.finsight.backend.enums;

public enum CategoryType {
    INCOME,
    EXPENSE
}
