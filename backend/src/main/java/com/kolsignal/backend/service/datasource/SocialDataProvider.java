package com.kolsignal.backend.service.datasource;

import com.kolsignal.backend.model.SocialMetrics;

public interface SocialDataProvider {
    SocialMetrics getSocialMetrics(String tokenAddress);
}
