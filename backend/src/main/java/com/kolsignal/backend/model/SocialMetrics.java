package com.kolsignal.backend.model;

import lombok.Builder;

import java.util.List;

/**
 * @param engagementQuality   0..1
 * @param accountAuthenticity 0..1
 * @param sentimentPolarity   -1..1
 * @param narrativeFit        detected narrative, null when none
 */
@Builder
public record SocialMetrics(
        double mentionVelocity1h,
        double engagementQuality,
        double accountAuthenticity,
        double sentimentPolarity,
        boolean kolMentionDetected,
        List<KolMention> kolMentions,
        String narrativeFit
) {

    public SocialMetrics {
        kolMentions = kolMentions == null ? List.of() : List.copyOf(kolMentions);
    }

    public static SocialMetrics empty() {
        return new SocialMetrics(0.0, 0.0, 0.0, 0.0, false, List.of(), null);
    }

    public record KolMention(String handle, MentionTier tier, Integer followers) {

        public boolean highTier() {
            return tier == MentionTier.S || tier == MentionTier.A;
        }
    }

    public enum MentionTier {
        S,
        A,
        B,
        C
    }
}
