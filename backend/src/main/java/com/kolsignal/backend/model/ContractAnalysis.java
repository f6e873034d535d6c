package com.kolsignal.backend.model;

public record ContractAnalysis(
        boolean mintAuthorityRevoked,
        boolean freezeAuthorityRevoked,
        boolean metadataMutable,
        boolean knownScamTemplate
) {

    /**
     * Assumes the worst about authorities when nothing is known about the contract.
     */
    public static ContractAnalysis conservativeDefault() {
        return new ContractAnalysis(false, false, true, false);
    }

    public boolean bothAuthoritiesActive() {
        return !mintAuthorityRevoked && !freezeAuthorityRevoked;
    }
}
