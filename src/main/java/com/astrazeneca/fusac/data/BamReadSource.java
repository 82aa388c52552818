package com.astrazeneca.fusac.data;

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.ValidationStringency;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads overlapping the 0-based interval [position0, position0 + 1) of the site, fetched from indexed BAM.
 */
public class BamReadSource implements ReadSource {
    private final String bam;
    private final String samfilter;
    private final ValidationStringency stringency;

    public BamReadSource(String bam, String samfilter, ValidationStringency stringency) {
        this.bam = bam;
        this.samfilter = samfilter;
        this.stringency = stringency;
    }

    @Override
    public List<UmiRead> fetch(VariantSite site) {
        List<UmiRead> reads = new ArrayList<>();
        // SamView takes 1-based closed interval, so the single position is the VCF position itself
        try (SamView reader = new SamView(bam, samfilter, site.contig, site.position0 + 1, site.position0 + 1,
                stringency)) {
            SAMRecord record;
            while ((record = reader.read()) != null) {
                reads.add(UmiRead.fromRecord(record));
            }
        }
        return reads;
    }
}
