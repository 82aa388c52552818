package com.astrazeneca.fusac.postprocessmodules;

import com.astrazeneca.fusac.data.AnnotatedRecord;
import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.PositionSupport;
import com.astrazeneca.fusac.data.SupportCounts;
import com.astrazeneca.fusac.data.scopedata.Scope;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.GenotypeBuilder;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Last step of the pipeline: writes molecular support of the position into UMI and SUMI format fields of each
 * sample and sets FFPE filter if any paired molecule was classified as FFPE artefact.
 */
public class RecordAnnotator implements Function<Scope<PositionSupport>, AnnotatedRecord> {
    public static final String FFPE_FILTER = "FFPE";
    public static final String UMI_FORMAT = "UMI";
    public static final String SUMI_FORMAT = "SUMI";

    private final FfpeScope ffpeScope;

    public RecordAnnotator() {
        this(instance().conf.ffpeScope);
    }

    public RecordAnnotator(FfpeScope ffpeScope) {
        this.ffpeScope = ffpeScope;
    }

    @Override
    public AnnotatedRecord apply(Scope<PositionSupport> scope) {
        PositionSupport support = scope.data;
        VariantContext record = scope.record;
        String umi = formatUmi(support);
        String sumi = formatSingles(support);

        List<Genotype> genotypes = new ArrayList<>();
        for (Genotype genotype : record.getGenotypes()) {
            genotypes.add(new GenotypeBuilder(genotype)
                    .attribute(UMI_FORMAT, umi)
                    .attribute(SUMI_FORMAT, sumi)
                    .make());
        }
        VariantContextBuilder builder = new VariantContextBuilder(record).genotypes(genotypes);

        boolean ffpe = support.hasFfpeHits() && ffpeScope.includes(scope.site);
        if (ffpe) {
            Set<String> filters = new LinkedHashSet<>(record.getFilters());
            filters.add(FFPE_FILTER);
            builder.filters(filters);
        }
        return new AnnotatedRecord(builder.make(), scope.site, support, ffpe);
    }

    /**
     * @return paired:forwardSingle:reverseSingle of the alternate allele(s), then of the reference allele(s),
     * separated by semicolon
     */
    public static String formatUmi(PositionSupport support) {
        return join(support.getAlternate().values(), false) + ";" + join(support.getReference().values(), false);
    }

    /**
     * @return number of single strand molecules supporting the alternate allele(s), then the reference allele(s)
     */
    public static String formatSingles(PositionSupport support) {
        return join(support.getAlternate().values(), true) + ";" + join(support.getReference().values(), true);
    }

    private static String join(Iterable<SupportCounts> counts, boolean singlesOnly) {
        StringBuilder sb = new StringBuilder();
        for (SupportCounts count : counts) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(singlesOnly ? String.valueOf(count.singles()) : count.toString());
        }
        return sb.toString();
    }
}
