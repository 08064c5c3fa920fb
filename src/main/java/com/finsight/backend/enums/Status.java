package com.finsight.backend.enums;

public enum Status {
    ACTIVE,
    INACTIVE
}
