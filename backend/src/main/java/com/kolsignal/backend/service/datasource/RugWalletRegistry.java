package com.kolsignal.backend.service.datasource;

public interface RugWalletRegistry {
    boolean isRugWallet(String walletAddress);
}
