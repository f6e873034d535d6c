package com.kolsignal.backend.service.datasource;

import com.kolsignal.backend.model.TradeSignal;

import java.util.Optional;

/**
 * External store of discovery signals already sent, used to follow up with a
 * KOL validation when a tracked wallet later buys the same token.
 */
public interface DiscoveryLedger {

    Optional<TradeSignal> findDiscovery(String tokenAddress);

    void recordDiscovery(TradeSignal signal);

    /**
     * Called once a discovery has been followed up by a KOL validation signal.
     */
    void markValidated(String tokenAddress);
}
