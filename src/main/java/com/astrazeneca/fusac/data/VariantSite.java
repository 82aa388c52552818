package com.astrazeneca.fusac.data;

import com.astrazeneca.fusac.exception.UnsupportedVariantShapeException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Single nucleotide variant position taken from a variant record.
 */
public class VariantSite {
    /**
     * Chromosome name
     */
    public final String contig;
    /**
     * 1-based position as in VCF
     */
    public final int position;
    /**
     * 0-based position used for base calling
     */
    public final int position0;
    public final Set<Character> refAlleles;
    public final Set<Character> altAlleles;

    public VariantSite(String contig, int position, char ref, char alt) {
        this.contig = contig;
        this.position = position;
        this.position0 = position - 1;
        this.refAlleles = Collections.singleton(Character.toUpperCase(ref));
        this.altAlleles = Collections.singleton(Character.toUpperCase(alt));
    }

    /**
     * Creates site for the record. Only single base reference with one single base alternate is supported.
     * @param record variant record
     * @return site of the record
     * @throws UnsupportedVariantShapeException for indels, MNVs, multi-allelic and symbolic records
     */
    public static VariantSite of(VariantContext record) {
        Allele ref = record.getReference();
        List<Allele> alts = record.getAlternateAlleles();
        if (ref.length() != 1 || alts.size() != 1) {
            throw new UnsupportedVariantShapeException(record);
        }
        Allele alt = alts.get(0);
        if (alt.isSymbolic() || alt.length() != 1 || !Character.isLetter(alt.getBaseString().charAt(0))) {
            throw new UnsupportedVariantShapeException(record);
        }
        return new VariantSite(record.getContig(), record.getStart(),
                ref.getBaseString().charAt(0), alt.getBaseString().charAt(0));
    }

    public char getRef() {
        return refAlleles.iterator().next();
    }

    public char getAlt() {
        return altAlleles.iterator().next();
    }

    /**
     * @return substitution in the form REF>ALT
     */
    public String getMismatch() {
        return getRef() + ">" + getAlt();
    }

    public String printSite() {
        return contig + ":" + position + " " + getMismatch();
    }

    @Override
    public String toString() {
        return "VariantSite [contig=" + contig + ", position=" + position + ", ref=" + refAlleles
                + ", alt=" + altAlleles + "]";
    }
}
