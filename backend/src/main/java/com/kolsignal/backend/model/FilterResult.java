package com.kolsignal.backend.model;

/**
 * Risk filter outcome, declared from most to least permissive.
 */
public enum FilterResult {
    PASS,
    FLAG,
    REJECT;

    public FilterResult escalate(FilterResult other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
