package com.solis.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class OnchainSignal {
    String programId;
    String programName;
    long txCount;
    long uniqueSigners;
    Long txDelta;
    double txZScore;
}
