package com.solis.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TokenSignal {
    String id;
    String symbol;
    String name;
    double price;
    double volume24h;
    double marketCap;
    String category;
    /** Percent change of {@code volume24h} against the previous report. */
    Double volumeDelta;
    double volumeZScore;
}
