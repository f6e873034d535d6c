package com.kolsignal.backend.model;

import java.util.List;

public record DevWalletBehaviour(
        String deployerAddress,
        double soldPercent48h,
        boolean transferredToCex,
        List<String> cexAddresses,
        boolean bridgeActivity
) {

    public DevWalletBehaviour {
        cexAddresses = cexAddresses == null ? List.of() : List.copyOf(cexAddresses);
    }

    public boolean deployerKnown() {
        return deployerAddress != null && !deployerAddress.isBlank();
    }
}
