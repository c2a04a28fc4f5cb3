package com.tracking.engine.platform;

public enum TransportType {
    WIFI,
    CELLULAR,
    ETHERNET,
    NONE;

    public boolean connected() {
        return this != NONE;
    }
}
