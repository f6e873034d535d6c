package com.kolsignal.backend.service.datasource;

import com.kolsignal.backend.model.TradeSignal;

public interface SignalPublisher {
    void publish(TradeSignal signal);
}
