package com.astrazeneca.fusac.data;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import htsjdk.samtools.SAMRecord;

import java.util.Arrays;

/**
 * Read view needed to group reads into molecules and call bases. Reference positions are 0-based and
 * cover the full query length: soft clipped and inserted bases keep their index with NO_POSITION.
 */
public class UmiRead {
    public static final int NO_POSITION = -1;
    public static final String UMI_TAG = "RX";

    private final String name;
    private final String umiTag;
    private final boolean firstOfPair;
    private final boolean reverseStrand;
    private final String bases;
    private final int[] referencePositions;

    public UmiRead(String name, String umiTag, boolean firstOfPair, boolean reverseStrand,
                   String bases, int[] referencePositions) {
        this.name = name;
        this.umiTag = umiTag;
        this.firstOfPair = firstOfPair;
        this.reverseStrand = reverseStrand;
        this.bases = bases;
        this.referencePositions = referencePositions.clone();
    }

    /**
     * Creates read view from SAM record. Reference position of each query base is found by walking the CIGAR.
     * @param record record from BAM file
     * @return read view
     */
    public static UmiRead fromRecord(SAMRecord record) {
        String bases = record.getReadBases().length == 0 ? "" : record.getReadString();
        boolean firstOfPair = record.getReadPairedFlag() && record.getFirstOfPairFlag();
        int[] positions = record.getReadUnmappedFlag()
                ? emptyPositions(bases.length())
                : referencePositions(record.getCigar(), record.getAlignmentStart() - 1, bases.length());
        return new UmiRead(record.getReadName(), record.getStringAttribute(UMI_TAG), firstOfPair,
                record.getReadNegativeStrandFlag(), bases, positions);
    }

    /**
     * Maps each query index to 0-based reference coordinate.
     * @param cigar alignment CIGAR
     * @param start 0-based alignment start
     * @param readLength number of query bases
     * @return array of reference coordinates, NO_POSITION for clipped and inserted bases
     */
    static int[] referencePositions(Cigar cigar, int start, int readLength) {
        int[] positions = emptyPositions(readLength);
        int queryIndex = 0;
        int referencePosition = start;
        for (CigarElement element : cigar.getCigarElements()) {
            CigarOperator operator = element.getOperator();
            int length = element.getLength();
            if (operator.consumesReadBases() && operator.consumesReferenceBases()) {
                for (int i = 0; i < length && queryIndex < readLength; i++) {
                    positions[queryIndex++] = referencePosition++;
                }
            } else if (operator.consumesReadBases()) {
                queryIndex += length;
            } else if (operator.consumesReferenceBases()) {
                referencePosition += length;
            }
        }
        return positions;
    }

    private static int[] emptyPositions(int readLength) {
        int[] positions = new int[readLength];
        Arrays.fill(positions, NO_POSITION);
        return positions;
    }

    /**
     * @param position 0-based reference coordinate
     * @return index of the query base aligned to position or NO_POSITION
     */
    public int queryIndexOf(int position) {
        for (int i = 0; i < referencePositions.length; i++) {
            if (referencePositions[i] == position) {
                return i;
            }
        }
        return NO_POSITION;
    }

    public String getName() {
        return name;
    }

    /**
     * @return value of RX tag or null if the read has no such tag
     */
    public String getUmiTag() {
        return umiTag;
    }

    public boolean isFirstOfPair() {
        return firstOfPair;
    }

    public boolean isReverseStrand() {
        return reverseStrand;
    }

    public String getBases() {
        return bases;
    }

    /**
     * @return copy of the query-to-reference map
     */
    public int[] getReferencePositions() {
        return referencePositions.clone();
    }

    @Override
    public String toString() {
        return name + (firstOfPair ? "/1" : "/2") + (reverseStrand ? "-" : "+");
    }
}
