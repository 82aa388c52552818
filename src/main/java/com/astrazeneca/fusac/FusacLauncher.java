package com.astrazeneca.fusac;

import com.astrazeneca.fusac.data.BamReadSource;
import com.astrazeneca.fusac.data.ReadSource;
import com.astrazeneca.fusac.data.SamView;
import com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope;
import com.astrazeneca.fusac.exception.MissedInputException;
import com.astrazeneca.fusac.modes.AbstractMode;
import com.astrazeneca.fusac.modes.AnnotationMode;
import com.astrazeneca.fusac.printers.VariantPrinter;
import htsjdk.variant.vcf.VCFFileReader;

import java.io.File;
import java.io.IOException;

import static com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Class starts the FUSAC for current run
 */
public class FusacLauncher {

    /**
     * Initialize resources, opens VCF and output and starts the mode (parallel if more than one thread is set).
     * @param config starting configuration
     */
    public void start(Configuration config) {
        long start = System.currentTimeMillis();
        initResources(config);

        final Configuration conf = instance().conf;
        ReadSource readSource = new BamReadSource(conf.bam, conf.samfilter, conf.validationStringency);

        try (VCFFileReader vcfReader = new VCFFileReader(new File(conf.vcf), false);
             VariantPrinter variantPrinter = VariantPrinter.createPrinter(conf, vcfReader.getFileHeader())) {
            AbstractMode mode = new AnnotationMode(vcfReader, readSource, variantPrinter);
            if (conf.threads == 1) {
                try {
                    mode.notParallel();
                } finally {
                    SamView.closeAll();
                }
            } else {
                mode.parallel();
            }

            System.err.println("Records written: " + variantPrinter.getPrinted()
                    + ", annotated: " + variantPrinter.getAnnotated()
                    + ", FFPE: " + variantPrinter.getFfpe()
                    + ", continued exceptions: " + conf.exceptionCounter.get());
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        System.err.println("Total runtime: " + (System.currentTimeMillis() - start) / 1000.0 + "s");
    }

    /**
     * Checks that input files exist and initializes GlobalReadOnlyScope.
     * @param conf FUSAC Configuration (parameters from command line)
     */
    private void initResources(Configuration conf) {
        if (conf.bam == null || !new File(conf.bam).canRead()) {
            throw new MissedInputException("BAM", conf.bam, "-b");
        }
        if (conf.vcf == null || !new File(conf.vcf).canRead()) {
            throw new MissedInputException("VCF", conf.vcf, "-v");
        }
        GlobalReadOnlyScope.init(conf);
    }
}
