package com.astrazeneca.fusac.data;

import java.util.Objects;

/**
 * Canonical identifier of a physical fragment. Reads of both strands and both mates of the same fragment
 * get the same key.
 */
public class MoleculeKey {
    private final String first;
    private final String second;

    public MoleculeKey(String first, String second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Orders barcodes so that the key doesn't depend on the read: forward molecule keeps read order,
     * reverse molecule swaps it.
     * @param umi barcodes as read
     * @param strand strand of the molecule the read belongs to
     * @return canonical key
     */
    public static MoleculeKey of(UmiPair umi, MoleculeStrand strand) {
        return strand == MoleculeStrand.FORWARD_MOLECULE
                ? new MoleculeKey(umi.left, umi.right)
                : new MoleculeKey(umi.right, umi.left);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MoleculeKey that = (MoleculeKey) o;
        return Objects.equals(first, that.first) &&
                Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return first + "_" + second;
    }
}
