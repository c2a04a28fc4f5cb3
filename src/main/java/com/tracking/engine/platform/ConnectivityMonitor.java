package com.tracking.engine.platform;

public interface ConnectivityMonitor {

    TransportType currentTransport();
}
