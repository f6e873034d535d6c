package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.model.FilterResult;

import java.util.List;

/**
 * Result of a single risk stage: carry on, carry on with flags, or stop the cascade.
 */
public record StageVerdict(Outcome outcome, List<String> flags) {

    private static final StageVerdict PROCEED = new StageVerdict(Outcome.CONTINUE, List.of());

    public StageVerdict {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static StageVerdict proceed() {
        return PROCEED;
    }

    public static StageVerdict flag(List<String> reasons) {
        return new StageVerdict(Outcome.FLAG, reasons);
    }

    public static StageVerdict flag(String reason) {
        return flag(List.of(reason));
    }

    public static StageVerdict reject(String reason) {
        return new StageVerdict(Outcome.REJECT, List.of(reason));
    }

    public boolean terminal() {
        return outcome == Outcome.REJECT;
    }

    public FilterResult toFilterResult() {
        return switch (outcome) {
            case CONTINUE -> FilterResult.PASS;
            case FLAG -> FilterResult.FLAG;
            case REJECT -> FilterResult.REJECT;
        };
    }

    public enum Outcome {
        CONTINUE,
        FLAG,
        REJECT
    }
}
