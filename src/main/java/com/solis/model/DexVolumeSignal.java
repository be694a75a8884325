package com.solis.model;

import lombok.Builder;
import lombok.Value;

/**
 * 24h traded volume of one DEX protocol. {@code volumeDelta} is a percentage.
 */
@Value
@Builder(toBuilder = true)
public class DexVolumeSignal {
    String protocol;
    double volume24h;
    Double volumeDelta;
    double volumeZScore;
}
