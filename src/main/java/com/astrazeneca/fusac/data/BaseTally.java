package com.astrazeneca.fusac.data;

import com.astrazeneca.fusac.exception.MissingAlleleException;

import java.util.Arrays;

/**
 * Counts of base symbols observed at one coordinate over a list of reads of one strand of molecule.
 * The sum of all counts equals the number of reads tallied.
 */
public class BaseTally {
    private final int[] counts = new int[BaseSymbol.values().length];

    public void add(BaseSymbol symbol) {
        counts[symbol.ordinal()]++;
    }

    public int count(BaseSymbol symbol) {
        return counts[symbol.ordinal()];
    }

    /**
     * Count for an allele of variant record.
     * @param allele allele character
     * @return number of reads showing the allele
     * @throws MissingAlleleException if allele is not a tallied symbol
     */
    public int count(char allele) {
        BaseSymbol symbol = BaseSymbol.forAllele(allele);
        if (symbol == null) {
            throw new MissingAlleleException(allele);
        }
        return count(symbol);
    }

    public int total() {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(counts, ((BaseTally) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (BaseSymbol symbol : BaseSymbol.values()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(symbol.getSymbol()).append(':').append(count(symbol));
        }
        return sb.append('}').toString();
    }
}
