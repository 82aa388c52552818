package com.astrazeneca.fusac.data;

/**
 * Verdict for a molecule sequenced from both strands.
 */
public enum HitCategory {
    /** No alternate support, reference base on both strands */
    REFERENCE,
    /** Alternate allele on both strands */
    MUTATION,
    /** Alternate allele on one strand only */
    FFPE,
    /** Nothing above, e.g. N or deletion against reference on the other strand */
    OTHER
}
