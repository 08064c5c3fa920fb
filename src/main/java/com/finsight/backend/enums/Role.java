package com.finsight.backend.enums;

public enum Role {
    USER,
    ADMIN
}
