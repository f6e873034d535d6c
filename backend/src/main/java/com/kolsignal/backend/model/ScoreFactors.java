package com.kolsignal.backend.model;

public record ScoreFactors(
        double onChainHealth,
        double socialMomentum,
        double kolConvictionMain,
        double kolConvictionSide,
        double scamRiskInverse,
        double narrativeBonus,
        double timingBonus
) {

    public ScoreFactors withKolConviction(double main, double side) {
        return new ScoreFactors(onChainHealth, socialMomentum, main, side, scamRiskInverse, narrativeBonus, timingBonus);
    }
}
