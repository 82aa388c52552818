package com.astrazeneca.fusac.data;

/**
 * Symbols a read can show at a reference coordinate. GAP means the coordinate is not covered by any
 * aligned base of the read (deletion spanning the position).
 */
public enum BaseSymbol {
    A('A'),
    T('T'),
    G('G'),
    C('C'),
    N('N'),
    GAP('-');

    private final char symbol;

    BaseSymbol(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * Normalizes a base from the query sequence. Anything that is not A, T, G or C (ambiguity codes,
     * caller N output) is reported as N.
     * @param base base from the read sequence
     * @return normalized symbol, never GAP
     */
    public static BaseSymbol fromBase(char base) {
        switch (Character.toUpperCase(base)) {
            case 'A': return A;
            case 'T': return T;
            case 'G': return G;
            case 'C': return C;
            default:  return N;
        }
    }

    /**
     * Exact lookup of an allele character.
     * @param allele allele character from variant record
     * @return symbol or null if the character is not one of the tallied symbols
     */
    public static BaseSymbol forAllele(char allele) {
        char upper = Character.toUpperCase(allele);
        for (BaseSymbol symbol : values()) {
            if (symbol.symbol == upper) {
                return symbol;
            }
        }
        return null;
    }
}
