package com.nosota.mpayout.model;

public enum FundCategory {
    CASH,
    ONLINE,
    SETTLEMENT,
    PAYOUT
}
