package com.kolsignal.backend.service;

import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.service.datasource.KolActivityProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Final yes/no on a scored token. Never throws: missing input means the gate is not
 * met.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SignalGateService {

    private final SignalProperties signalProperties;
    private final KolActivityProvider kolActivityProvider;

    public GateDecision meetsBuyRequirements(TokenScore score, List<KolWalletActivity> activities) {
        if (score == null) {
            return GateDecision.fail("No score available");
        }
        double minScore = signalProperties.getGate().getMinBuyScore();
        if (score.compositeScore() < minScore) {
            return GateDecision.fail(String.format(Locale.ROOT, "Score %.0f below minimum %.0f",
                    score.compositeScore(), minScore));
        }
        if (activities == null || activities.isEmpty()) {
            return GateDecision.fail("No KOL activity detected");
        }
        boolean anyQualifies = activities.stream().anyMatch(this::qualifies);
        if (!anyQualifies) {
            return GateDecision.fail("No KOL activity meets confidence requirements");
        }
        return GateDecision.pass();
    }

    public GateDecision meetsDiscoveryRequirements(TokenScore score, ScamFilterOutput filter) {
        if (score == null || filter == null) {
            return GateDecision.fail("No score available");
        }
        double minScore = signalProperties.getGate().getMinDiscoveryScore();
        if (score.compositeScore() < minScore) {
            return GateDecision.fail(String.format(Locale.ROOT, "Score %.0f below discovery minimum %.0f",
                    score.compositeScore(), minScore));
        }
        if (filter.rejected()) {
            return GateDecision.fail("Failed safety checks");
        }
        ContractAnalysis contract = filter.contractAnalysis();
        if (contract.bothAuthoritiesActive()) {
            return GateDecision.fail("Both mint and freeze authorities still enabled");
        }
        if (contract.knownScamTemplate()) {
            return GateDecision.fail("Known scam template detected");
        }
        return GateDecision.pass();
    }

    private boolean qualifies(KolWalletActivity activity) {
        try {
            return kolActivityProvider.meetsSignalRequirements(activity);
        } catch (RuntimeException e) {
            log.warn("KOL requirement check failed for {}, treating as not qualifying: {}",
                    activity.kol() != null ? activity.kol().handle() : "unknown", e.getMessage());
            return false;
        }
    }

    public record GateDecision(boolean meets, String reason) {

        private static final GateDecision PASS = new GateDecision(true, null);

        public static GateDecision pass() {
            return PASS;
        }

        public static GateDecision fail(String reason) {
            return new GateDecision(false, reason);
        }
    }
}
