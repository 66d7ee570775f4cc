package com.nosota.mpayout.model;

/**
 * Role of the entity a scheme is mapped to.
 */
public enum EntityRole {
    RETAILER,
    DISTRIBUTOR,
    MASTER_DISTRIBUTOR
}
