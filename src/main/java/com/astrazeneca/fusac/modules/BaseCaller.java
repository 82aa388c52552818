package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.BaseSymbol;
import com.astrazeneca.fusac.data.BaseTally;
import com.astrazeneca.fusac.data.UmiRead;

import java.util.List;

/**
 * Calls the base of a read at a fixed reference coordinate.
 */
public final class BaseCaller {

    private BaseCaller() {
    }

    /**
     * Looks up the coordinate in the read's query-to-reference map.
     * @param read aligned read
     * @param position 0-based reference coordinate
     * @return base at the found index normalized to A, T, G, C or N; GAP if no query base is aligned to position
     */
    public static BaseSymbol call(UmiRead read, int position) {
        int index = read.queryIndexOf(position);
        String bases = read.getBases();
        if (index == UmiRead.NO_POSITION || index >= bases.length()) {
            return BaseSymbol.GAP;
        }
        return BaseSymbol.fromBase(bases.charAt(index));
    }

    /**
     * Counts base calls of the reads at coordinate.
     * @param reads reads of one molecule strand
     * @param position 0-based reference coordinate
     * @return tally with total equal to number of reads
     */
    public static BaseTally tally(List<UmiRead> reads, int position) {
        BaseTally tally = new BaseTally();
        for (UmiRead read : reads) {
            tally.add(call(read, position));
        }
        return tally;
    }
}
