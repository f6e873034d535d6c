package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Piecewise-linear timing bonus over token age. Anchors must rise to a single plateau
 * and then fall; ages before the first anchor or after the last one take the
 * nearest anchor's bonus.
 */
@Component
public class TimingCurve {

    private final List<ScoringProperties.Anchor> anchors;

    public TimingCurve(ScoringProperties scoringProperties) {
        this.anchors = validate(scoringProperties.getTiming().getAnchors());
    }

    public double bonus(double ageMinutes) {
        ScoringProperties.Anchor first = anchors.get(0);
        if (ageMinutes <= first.getAgeMinutes()) {
            return first.getBonus();
        }
        for (int i = 1; i < anchors.size(); i++) {
            ScoringProperties.Anchor right = anchors.get(i);
            if (ageMinutes <= right.getAgeMinutes()) {
                ScoringProperties.Anchor left = anchors.get(i - 1);
                double span = right.getAgeMinutes() - left.getAgeMinutes();
                double position = (ageMinutes - left.getAgeMinutes()) / span;
                return left.getBonus() + (right.getBonus() - left.getBonus()) * position;
            }
        }
        return anchors.get(anchors.size() - 1).getBonus();
    }

    static List<ScoringProperties.Anchor> validate(List<ScoringProperties.Anchor> configured) {
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("Timing curve needs at least one anchor");
        }
        List<ScoringProperties.Anchor> sorted = configured.stream()
                .sorted(Comparator.comparingDouble(ScoringProperties.Anchor::getAgeMinutes))
                .toList();
        boolean falling = false;
        for (int i = 1; i < sorted.size(); i++) {
            ScoringProperties.Anchor prev = sorted.get(i - 1);
            ScoringProperties.Anchor curr = sorted.get(i);
            if (curr.getAgeMinutes() == prev.getAgeMinutes()) {
                throw new IllegalStateException("Duplicate timing anchor at " + curr.getAgeMinutes() + " minutes");
            }
            if (curr.getBonus() < prev.getBonus()) {
                falling = true;
            } else if (curr.getBonus() > prev.getBonus() && falling) {
                throw new IllegalStateException("Timing curve must have a single peak, rises again at "
                        + curr.getAgeMinutes() + " minutes");
            }
        }
        return sorted;
    }
}
