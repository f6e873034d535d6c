package com.kolsignal.backend.service.datasource;

public interface PositionTracker {
    boolean hasOpenPosition(String tokenAddress);
}
