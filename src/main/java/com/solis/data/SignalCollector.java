package com.solis.data;

import com.solis.model.SignalSet;

import java.time.LocalDate;

@FunctionalInterface
public interface SignalCollector {

    SignalSet collect(LocalDate date) throws Exception;
}
