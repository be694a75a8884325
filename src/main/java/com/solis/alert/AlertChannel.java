package com.solis.alert;

import java.io.IOException;

/**
 * Delivery target for alert text.
 */
public interface AlertChannel {

    String name();

    void send(String text) throws IOException, InterruptedException;
}
