package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.*;
import com.astrazeneca.fusac.data.scopedata.Scope;
import com.astrazeneca.fusac.exception.UnparseableUmiException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;
import static com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Groups reads into molecules by canonical UMI key. Each molecule keeps forward and reverse molecule reads apart.
 */
public class MoleculeGrouper implements Module<List<UmiRead>, Map<MoleculeKey, MoleculeGroup>> {
    private final UmiExtractor umiExtractor;

    public MoleculeGrouper() {
        this(new UmiExtractor(instance().conf));
    }

    public MoleculeGrouper(UmiExtractor umiExtractor) {
        this.umiExtractor = umiExtractor;
    }

    @Override
    public Scope<Map<MoleculeKey, MoleculeGroup>> process(Scope<List<UmiRead>> scope) {
        return new Scope<>(scope, group(scope.data, scope.site));
    }

    public Map<MoleculeKey, MoleculeGroup> group(List<UmiRead> reads) {
        return group(reads, null);
    }

    /**
     * Reads with unparseable UMI are reported and skipped.
     * @param reads reads overlapping the site
     * @param site site used for error reports
     * @return molecules in order of first read
     */
    Map<MoleculeKey, MoleculeGroup> group(List<UmiRead> reads, VariantSite site) {
        Map<MoleculeKey, MoleculeGroup> molecules = new LinkedHashMap<>();
        for (UmiRead read : reads) {
            UmiPair umi;
            try {
                umi = umiExtractor.extract(read);
            } catch (UnparseableUmiException exception) {
                printExceptionAndContinue(exception, "read", read.getName(), site);
                continue;
            }
            MoleculeStrand strand = MoleculeStrand.of(read);
            molecules.computeIfAbsent(MoleculeKey.of(umi, strand), k -> new MoleculeGroup()).add(strand, read);
        }
        return molecules;
    }
}
