package com.astrazeneca.fusac.printers;

import com.astrazeneca.fusac.Configuration;
import com.astrazeneca.fusac.data.AnnotatedRecord;
import htsjdk.variant.variantcontext.writer.Options;
import htsjdk.variant.variantcontext.writer.VariantContextWriter;
import htsjdk.variant.variantcontext.writer.VariantContextWriterBuilder;
import htsjdk.variant.vcf.*;

import java.io.File;
import java.io.FileNotFoundException;

import static com.astrazeneca.fusac.postprocessmodules.RecordAnnotator.FFPE_FILTER;
import static com.astrazeneca.fusac.postprocessmodules.RecordAnnotator.SUMI_FORMAT;
import static com.astrazeneca.fusac.postprocessmodules.RecordAnnotator.UMI_FORMAT;

/**
 * Writes processed records to the output VCF and, if set, to the CSV summary. Only one thread (the writer of
 * the running mode) may use a printer.
 */
public class VariantPrinter implements AutoCloseable {
    private final VariantContextWriter writer;
    private final CsvSummaryPrinter csvPrinter;

    private int printed;
    private int annotated;
    private int ffpe;

    public VariantPrinter(VariantContextWriter writer, CsvSummaryPrinter csvPrinter) {
        this.writer = writer;
        this.csvPrinter = csvPrinter;
    }

    /**
     * Factory method creating VCF writer (and CSV printer if enabled in configuration) and writing the extended header.
     * @param conf configuration with output paths
     * @param inputHeader header of input VCF
     * @return created printer
     * @throws FileNotFoundException if CSV summary can't be created
     */
    public static VariantPrinter createPrinter(Configuration conf, VCFHeader inputHeader) throws FileNotFoundException {
        File output = new File(conf.output);
        VariantContextWriterBuilder builder = new VariantContextWriterBuilder()
                .clearOptions()
                .setOutputFile(output)
                .setOption(Options.ALLOW_MISSING_FIELDS_IN_HEADER);
        if (VariantContextWriterBuilder.determineOutputTypeFromFile(output) == VariantContextWriterBuilder.OutputType.UNSPECIFIED) {
            builder.setOutputFileType(VariantContextWriterBuilder.OutputType.VCF);
        }
        VariantContextWriter writer = builder.build();
        writer.writeHeader(extendHeader(inputHeader));

        CsvSummaryPrinter csvPrinter = conf.csvFile
                ? new CsvSummaryPrinter(new File(conf.csvOutput()), conf.ffpeScope, conf.percentageMin, conf.percentageMax)
                : null;
        return new VariantPrinter(writer, csvPrinter);
    }

    /**
     * Copies the header and adds FFPE filter and UMI, SUMI format lines.
     * @param inputHeader header of input VCF
     * @return new header for output
     */
    public static VCFHeader extendHeader(VCFHeader inputHeader) {
        VCFHeader header = new VCFHeader(inputHeader);
        header.addMetaDataLine(new VCFFilterHeaderLine(FFPE_FILTER, "FFPE Artefact"));
        header.addMetaDataLine(new VCFFormatHeaderLine(UMI_FORMAT, VCFHeaderLineCount.UNBOUNDED, VCFHeaderLineType.String,
                "Molecular support for variant then reference Paired:SForward:SReverse"));
        header.addMetaDataLine(new VCFFormatHeaderLine(SUMI_FORMAT, VCFHeaderLineCount.UNBOUNDED, VCFHeaderLineType.String,
                "Single strand molecule support for variant then reference"));
        return header;
    }

    public void print(AnnotatedRecord record) {
        writer.add(record.record);
        printed++;
        if (record.isAnnotated()) {
            annotated++;
            if (record.ffpe) {
                ffpe++;
            }
            if (csvPrinter != null) {
                csvPrinter.print(record);
            }
        }
    }

    public int getPrinted() {
        return printed;
    }

    public int getAnnotated() {
        return annotated;
    }

    public int getFfpe() {
        return ffpe;
    }

    @Override
    public void close() {
        writer.close();
        if (csvPrinter != null) {
            csvPrinter.close();
        }
    }
}
