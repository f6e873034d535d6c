package com.kolsignal.backend.service.datasource;

import com.kolsignal.backend.model.KolWalletActivity;

import java.time.Duration;
import java.util.List;

/**
 * Read side of the KOL tracker. Reputation and wallet attribution live behind this
 * interface; the pipeline only consumes their outputs.
 */
public interface KolActivityProvider {

    List<KolWalletActivity> getKolActivity(String tokenAddress, Duration window);

    double calculateSignalWeight(KolWalletActivity activity);

    boolean meetsSignalRequirements(KolWalletActivity activity);
}
