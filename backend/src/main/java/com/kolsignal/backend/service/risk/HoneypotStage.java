package com.kolsignal.backend.service.risk;

import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class HoneypotStage implements RiskStage {

    @Override
    public String name() {
        return "honeypot";
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public StageVerdict evaluate(RiskFilterInput input) {
        Optional<Boolean> honeypot = input.honeypot();
        if (honeypot.isEmpty()) {
            // Never pass silently: sellability was not confirmed
            return StageVerdict.flag("HONEYPOT_UNAVAILABLE: Honeypot analysis unavailable - sellability not confirmed");
        }
        if (honeypot.get()) {
            return StageVerdict.reject("HONEYPOT: Token cannot be sold - confirmed honeypot");
        }
        return StageVerdict.proceed();
    }
}
