package com.nosota.mpayout.model;

public enum ChargeType {
    FLAT,
    PERCENTAGE
}
