package com.solis.cache;

public enum LookupStatus {
    HIT,
    MISS,
    EXPIRED,
    CORRUPT
}
