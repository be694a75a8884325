package com.solis.data;

import com.solis.model.SignalFamily;

import java.time.LocalDate;
import java.util.List;

/**
 * Named fallible fetch of one signal family's records for a date.
 */
public interface SignalSource<T> {

    SignalFamily family();

    List<T> fetch(LocalDate date) throws Exception;

    default String name() {
        return family().id();
    }
}
