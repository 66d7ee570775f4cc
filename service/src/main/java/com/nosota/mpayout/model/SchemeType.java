package com.nosota.mpayout.model;

/**
 * GLOBAL schemes apply to everyone without a mapping.
 */
public enum SchemeType {
    GLOBAL,
    CUSTOM
}
