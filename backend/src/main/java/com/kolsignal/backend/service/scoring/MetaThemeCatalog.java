package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Versioned list of narrative themes currently considered strong.
 */
@Component
public class MetaThemeCatalog {

    @Getter
    private final String version;
    private final List<String> themes;

    public MetaThemeCatalog(ScoringProperties scoringProperties) {
        ScoringProperties.Narrative narrative = scoringProperties.getNarrative();
        this.version = narrative.getThemesVersion();
        this.themes = narrative.getThemes().stream()
                .filter(theme -> theme != null && !theme.isBlank())
                .map(theme -> theme.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean matchesAny(String... texts) {
        for (String text : texts) {
            if (text == null) {
                continue;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            for (String theme : themes) {
                if (lower.contains(theme)) {
                    return true;
                }
            }
        }
        return false;
    }

    public List<String> themes() {
        return themes;
    }
}
