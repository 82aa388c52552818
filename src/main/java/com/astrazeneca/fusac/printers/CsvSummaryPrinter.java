package com.astrazeneca.fusac.printers;

import com.astrazeneca.fusac.data.AnnotatedRecord;
import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.HitCategory;
import com.astrazeneca.fusac.data.PositionSupport;
import com.astrazeneca.fusac.data.VariantSite;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import static com.astrazeneca.fusac.Utils.join;

/**
 * Summary of annotated records: paired support of reference and variant, number of FFPE molecules and
 * FFPE VAF (percentage of paired molecules classified as FFPE). Only records with FFPE VAF in the inclusive
 * range are printed.
 */
public class CsvSummaryPrinter implements AutoCloseable {
    public static final String DELIMITER = ",";
    public static final String HEADER = join(DELIMITER,
            "Chrom", "Position", "Ref", "Alt", "Mismatch", "RefSupport", "VarSupport", "FfpeCalls", "FfpeVaf");

    private static final DecimalFormat VAF_FORMAT = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.US));

    private final PrintStream out;
    private final FfpeScope ffpeScope;
    private final int percentageMin;
    private final int percentageMax;

    public CsvSummaryPrinter(File file, FfpeScope ffpeScope, int percentageMin, int percentageMax)
            throws FileNotFoundException {
        this(new PrintStream(file), ffpeScope, percentageMin, percentageMax);
    }

    public CsvSummaryPrinter(PrintStream out, FfpeScope ffpeScope, int percentageMin, int percentageMax) {
        this.out = out;
        this.ffpeScope = ffpeScope;
        this.percentageMin = percentageMin;
        this.percentageMax = percentageMax;
        out.println(HEADER);
    }

    public void print(AnnotatedRecord record) {
        VariantSite site = record.site;
        if (!ffpeScope.includes(site)) {
            return;
        }
        PositionSupport support = record.support;
        double vaf = ffpeVaf(support);
        if (vaf < percentageMin || vaf > percentageMax) {
            return;
        }
        out.println(join(DELIMITER,
                site.contig,
                site.position,
                site.getRef(),
                site.getAlt(),
                site.getMismatch(),
                support.reference(site.getRef()).paired,
                support.alternate(site.getAlt()).paired,
                support.getMolecules(HitCategory.FFPE),
                VAF_FORMAT.format(vaf)));
    }

    /**
     * @return percentage of paired molecules classified as FFPE, 0 if there are no paired molecules
     */
    public static double ffpeVaf(PositionSupport support) {
        int paired = support.getPairedMolecules();
        return paired == 0 ? 0 : 100.0 * support.getMolecules(HitCategory.FFPE) / paired;
    }

    @Override
    public void close() {
        out.close();
    }
}
