package com.astrazeneca.fusac.data;

/**
 * Strand of the original double-stranded fragment a read was derived from (not the mapped strand of the read).
 */
public enum MoleculeStrand {
    FORWARD_MOLECULE,
    REVERSE_MOLECULE;

    /**
     * First mate on forward strand and second mate on reverse strand come from the forward molecule,
     * the two other combinations from the reverse one.
     * @param read aligned read
     * @return strand of the molecule
     */
    public static MoleculeStrand of(UmiRead read) {
        return read.isFirstOfPair() != read.isReverseStrand() ? FORWARD_MOLECULE : REVERSE_MOLECULE;
    }
}
