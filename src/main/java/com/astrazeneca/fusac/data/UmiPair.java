package com.astrazeneca.fusac.data;

import java.util.Objects;

/**
 * Two barcodes of a read. Order follows the read: which barcode is left depends on mate and strand.
 */
public class UmiPair {
    public final String left;
    public final String right;

    public UmiPair(String left, String right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UmiPair umiPair = (UmiPair) o;
        return Objects.equals(left, umiPair.left) &&
                Objects.equals(right, umiPair.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return left + "+" + right;
    }
}
