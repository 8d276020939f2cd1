package com.leverageloop.domain.enums;

public enum PositionStatus {
    ACTIVE,
    CLOSED
}
