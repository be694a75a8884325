package com.solis.analysis;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

public record Metric<T>(String name, ToDoubleFunction<T> extract) {
    public Metric {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(extract, "extract");
    }

    public static <T> Metric<T> of(String name, ToDoubleFunction<T> extract) {
        return new Metric<>(name, extract);
    }
}
