package com.astrazeneca.fusac.data;

import java.util.Objects;

/**
 * Molecular support of one allele at a position.
 */
public class SupportCounts {
    public int paired;
    public int forwardSingle;
    public int reverseSingle;

    public int singles() {
        return forwardSingle + reverseSingle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SupportCounts that = (SupportCounts) o;
        return paired == that.paired &&
                forwardSingle == that.forwardSingle &&
                reverseSingle == that.reverseSingle;
    }

    @Override
    public int hashCode() {
        return Objects.hash(paired, forwardSingle, reverseSingle);
    }

    /**
     * @return support in the form paired:forwardSingle:reverseSingle
     */
    @Override
    public String toString() {
        return paired + ":" + forwardSingle + ":" + reverseSingle;
    }
}
