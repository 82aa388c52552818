package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.*;
import com.astrazeneca.fusac.data.scopedata.Scope;
import com.astrazeneca.fusac.exception.MissingAlleleException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;

/**
 * Tallies each molecule at the site coordinate and classifies molecules sequenced from both strands.
 */
public class StrandClassifier implements Module<Map<MoleculeKey, MoleculeGroup>, List<MoleculeCall>> {

    @Override
    public Scope<List<MoleculeCall>> process(Scope<Map<MoleculeKey, MoleculeGroup>> scope) {
        VariantSite site = scope.site;
        List<MoleculeCall> calls = new ArrayList<>(scope.data.size());
        for (Map.Entry<MoleculeKey, MoleculeGroup> entry : scope.data.entrySet()) {
            MoleculeGroup group = entry.getValue();
            if (group.isEmpty()) {
                continue;
            }
            BaseTally forward = BaseCaller.tally(group.getForwardReads(), site.position0);
            BaseTally reverse = BaseCaller.tally(group.getReverseReads(), site.position0);
            Classification classification = group.isPaired()
                    ? classify(forward, reverse, site.refAlleles, site.altAlleles, site)
                    : null;
            calls.add(new MoleculeCall(entry.getKey(), forward, reverse, classification));
        }
        return new Scope<>(scope, calls);
    }

    public Classification classify(BaseTally forward, BaseTally reverse,
                                   Collection<Character> refAlleles, Collection<Character> altAlleles) {
        return classify(forward, reverse, refAlleles, altAlleles, null);
    }

    /**
     * Alternate alleles are checked first: support on both strands is a mutation, support on one strand only
     * is an FFPE artefact. The first alternate matching one of the rules decides. Without alternate support
     * the molecule is reference if a reference allele is seen on both strands, otherwise other.
     * Alleles absent from the tallies are reported and excluded from comparison.
     */
    Classification classify(BaseTally forward, BaseTally reverse,
                            Collection<Character> refAlleles, Collection<Character> altAlleles, VariantSite site) {
        for (char alt : altAlleles) {
            int forwardCount;
            int reverseCount;
            try {
                forwardCount = forward.count(alt);
                reverseCount = reverse.count(alt);
            } catch (MissingAlleleException exception) {
                printExceptionAndContinue(exception, "allele", String.valueOf(alt), site);
                continue;
            }
            if (forwardCount > 0 && reverseCount > 0) {
                return new Classification(HitCategory.MUTATION, forward, reverse);
            }
            if (forwardCount > 0 || reverseCount > 0) {
                return new Classification(HitCategory.FFPE, forward, reverse);
            }
        }
        for (char ref : refAlleles) {
            try {
                if (forward.count(ref) > 0 && reverse.count(ref) > 0) {
                    return new Classification(HitCategory.REFERENCE, forward, reverse);
                }
            } catch (MissingAlleleException exception) {
                printExceptionAndContinue(exception, "allele", String.valueOf(ref), site);
            }
        }
        return new Classification(HitCategory.OTHER, forward, reverse);
    }
}
