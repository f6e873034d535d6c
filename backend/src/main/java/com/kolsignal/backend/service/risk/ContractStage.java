package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.config.RiskFilterProperties;
import com.kolsignal.backend.model.ContractAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class ContractStage implements RiskStage {

    private final RiskFilterProperties riskFilterProperties;

    @Override
    public String name() {
        return "contract";
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public StageVerdict evaluate(RiskFilterInput input) {
        if (input.contractAnalysis().isEmpty()) {
            return StageVerdict.flag("CONTRACT_UNAVAILABLE: Mint authority analysis unavailable");
        }
        ContractAnalysis analysis = input.contractAnalysis().get();
        if (analysis.knownScamTemplate()) {
            return StageVerdict.reject("SCAM_TEMPLATE: Contract matches known scam pattern");
        }

        List<String> flags = new ArrayList<>();
        if (!analysis.mintAuthorityRevoked()) {
            Double age = input.tokenAgeMinutes();
            double grace = riskFilterProperties.getContract().getMintAuthorityGraceMinutes();
            if (age != null && age > grace) {
                return StageVerdict.reject(String.format(Locale.ROOT,
                        "MINT_AUTHORITY: Not revoked after %.0f mins - tokens can still be minted", age));
            }
            flags.add("MINT_AUTHORITY: Not yet revoked - tokens can be minted (new token, monitoring)");
        }
        if (!analysis.freezeAuthorityRevoked()) {
            flags.add("FREEZE_AUTHORITY: Not revoked - tokens can be frozen");
        }
        if (analysis.metadataMutable()) {
            flags.add("METADATA_MUTABLE: Token metadata can be changed");
        }
        return flags.isEmpty() ? StageVerdict.proceed() : StageVerdict.flag(flags);
    }

    @Override
    public void record(RiskFilterInput input, FilterOutputDraft draft) {
        draft.contractAnalysis(input.contractAnalysis().orElseGet(ContractAnalysis::conservativeDefault));
    }
}
