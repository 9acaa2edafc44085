package com.mouse.smartbet.enums;

public enum ModelStatus {
    PRODUCTION,
    EXPERIMENTAL
}
