package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.*;
import com.astrazeneca.fusac.data.scopedata.Scope;
import com.astrazeneca.fusac.exception.MissingAlleleException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;

/**
 * Sums the molecule tallies into support of reference and alternate alleles. Paired molecules add both strand
 * counts to paired support, single strand molecules add to forward or reverse single support.
 */
public class PositionAggregator implements Module<List<MoleculeCall>, PositionSupport> {

    @Override
    public Scope<PositionSupport> process(Scope<List<MoleculeCall>> scope) {
        VariantSite site = scope.site;
        return new Scope<>(scope, aggregate(scope.data, site.refAlleles, site.altAlleles, site));
    }

    public PositionSupport aggregate(List<MoleculeCall> calls, Collection<Character> refAlleles,
                                     Collection<Character> altAlleles) {
        return aggregate(calls, refAlleles, altAlleles, null);
    }

    PositionSupport aggregate(List<MoleculeCall> calls, Collection<Character> refAlleles,
                              Collection<Character> altAlleles, VariantSite site) {
        PositionSupport support = new PositionSupport(refAlleles, altAlleles);
        for (MoleculeCall call : calls) {
            if (call.isPaired()) {
                support.addMolecule(call.classification.category);
            }
            addCall(support.getAlternate(), call, site);
            addCall(support.getReference(), call, site);
        }
        return support;
    }

    private void addCall(Map<Character, SupportCounts> alleles, MoleculeCall call, VariantSite site) {
        for (Map.Entry<Character, SupportCounts> entry : alleles.entrySet()) {
            char allele = entry.getKey();
            SupportCounts counts = entry.getValue();
            try {
                if (call.isPaired()) {
                    counts.paired += call.forward.count(allele) + call.reverse.count(allele);
                } else if (!call.forward.isEmpty()) {
                    counts.forwardSingle += call.forward.count(allele);
                } else {
                    counts.reverseSingle += call.reverse.count(allele);
                }
            } catch (MissingAlleleException exception) {
                printExceptionAndContinue(exception, "allele", String.valueOf(allele), site);
            }
        }
    }
}
