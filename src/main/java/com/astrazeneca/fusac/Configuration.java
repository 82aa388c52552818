package com.astrazeneca.fusac;

import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.UmiPosition;
import htsjdk.samtools.ValidationStringency;

import java.util.concurrent.atomic.AtomicInteger;

public class Configuration {
    public static final String DEFAULT_OUTPUT = "fusac_output.vcf";
    public static final String CSV_EXTENSION = ".csv";

    /**
     * The indexed BAM file
     */
    public String bam; // -b
    /**
     * The VCF file with variant calls to classify
     */
    public String vcf; // -v
    /**
     * Output VCF
     */
    public String output = DEFAULT_OUTPUT; // -o
    /**
     * Number of worker threads. Records are processed in the calling thread if set to 1.
     */
    public int threads = 1; // -t
    /**
     * Capacity of the queue between the producer of records and the writer
     */
    public int queueSize = 10; // -qs
    /**
     * Substitutions that may get FFPE filter: C:G>T:A only or all
     */
    public FfpeScope ffpeScope = FfpeScope.STANDARD; // -fn
    /**
     * Where the UMI is stored: last field of the read name or RX tag
     */
    public UmiPosition umiPosition = UmiPosition.QNAME; // -up
    /**
     * Character separating UMI from the rest of read name
     */
    public String qnameSplitCharacter = "_"; // -qsc
    /**
     * Character separating two barcodes of UMI. Empty string means split in half.
     */
    public String umiSplitCharacter = "+"; // -usc
    /**
     * Generate CSV summary next to the output VCF
     */
    public boolean csvFile = true; // -cf
    /**
     * Inclusive range of FFPE VAF (in percent) of records exported to CSV
     */
    public int percentageMin = 0; // -pe
    public int percentageMax = 100; // -pe

    public String samfilter = "0x0"; // -F

    public ValidationStringency validationStringency = ValidationStringency.LENIENT; // -VS

    /**
     * Debug mode. Will print stack traces of continued exceptions.
     */
    public boolean debug = false; // -D

    /**
     * Number of reads, alleles and records skipped because of exceptions during the run
     */
    public AtomicInteger exceptionCounter = new AtomicInteger(0);

    public String csvOutput() {
        return output + CSV_EXTENSION;
    }
}
