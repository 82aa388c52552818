package com.astrazeneca.fusac.data;

/**
 * Base tallies of one molecule at the variant coordinate. Classification is present only for paired molecules.
 */
public class MoleculeCall {
    public final MoleculeKey key;
    public final BaseTally forward;
    public final BaseTally reverse;
    public final Classification classification;

    public MoleculeCall(MoleculeKey key, BaseTally forward, BaseTally reverse, Classification classification) {
        this.key = key;
        this.forward = forward;
        this.reverse = reverse;
        this.classification = classification;
    }

    public boolean isPaired() {
        return classification != null;
    }
}
