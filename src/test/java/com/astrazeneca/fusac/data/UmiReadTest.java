package com.astrazeneca.fusac.data;

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.TextCigarCodec;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.*;

public class UmiReadTest {
    private SAMFileHeader header;

    @BeforeMethod
    public void setUp() {
        header = new SAMFileHeader();
        header.addSequence(new SAMSequenceRecord("chr8", 1000000));
    }

    @Test
    public void fromRecordKeepsClippedAndInsertedBasesInIndex() {
        SAMRecord record = new SAMRecord(header);
        record.setReadName("READ1_AAATTT+CCCGGG");
        record.setReferenceName("chr8");
        record.setAlignmentStart(101);
        record.setCigarString("2S3M1I2M2D3M");
        record.setReadString("CCATGTCAGTT");
        record.setReadPairedFlag(true);
        record.setFirstOfPairFlag(true);
        record.setReadNegativeStrandFlag(true);
        record.setAttribute("RX", "AAATTTCCCGGG");

        UmiRead read = UmiRead.fromRecord(record);

        assertEquals(read.getName(), "READ1_AAATTT+CCCGGG");
        assertEquals(read.getUmiTag(), "AAATTTCCCGGG");
        assertTrue(read.isFirstOfPair());
        assertTrue(read.isReverseStrand());
        assertEquals(read.getBases(), "CCATGTCAGTT");
        assertEquals(read.getReferencePositions(),
                new int[] {-1, -1, 100, 101, 102, -1, 103, 104, 107, 108, 109});
    }

    @Test
    public void unpairedReadIsNotFirstOfPair() {
        SAMRecord record = new SAMRecord(header);
        record.setReadName("READ2_AAA+CCC");
        record.setReferenceName("chr8");
        record.setAlignmentStart(1);
        record.setCigarString("4M");
        record.setReadString("ACGT");

        UmiRead read = UmiRead.fromRecord(record);

        assertFalse(read.isFirstOfPair());
        assertFalse(read.isReverseStrand());
        assertNull(read.getUmiTag());
        assertEquals(read.getReferencePositions(), new int[] {0, 1, 2, 3});
    }

    @Test
    public void unmappedReadHasNoPositions() {
        SAMRecord record = new SAMRecord(header);
        record.setReadName("READ3_AAA+CCC");
        record.setReadUnmappedFlag(true);
        record.setReadString("ACGT");

        UmiRead read = UmiRead.fromRecord(record);

        assertEquals(read.getReferencePositions(), new int[] {-1, -1, -1, -1});
    }

    @DataProvider(name = "cigars")
    public Object[][] cigars() {
        return new Object[][] {
                {"5M", 10, 5, new int[] {10, 11, 12, 13, 14}},
                {"1H2M2N2M", 0, 4, new int[] {0, 1, 4, 5}},
                {"2M3S", 7, 5, new int[] {7, 8, -1, -1, -1}},
                {"1M1D1M", 5, 2, new int[] {5, 7}},
        };
    }

    @Test(dataProvider = "cigars")
    public void referencePositions(String cigar, int start, int readLength, int[] expected) {
        assertEquals(UmiRead.referencePositions(TextCigarCodec.decode(cigar), start, readLength), expected);
    }

    @Test
    public void coordinateMapCantBeChangedFromOutside() {
        int[] positions = {0, 1, 2};
        UmiRead read = new UmiRead("READ1_AAA+CCC", null, true, false, "ACG", positions);

        positions[1] = 50;
        read.getReferencePositions()[2] = 60;

        assertEquals(read.getReferencePositions(), new int[] {0, 1, 2});
        assertEquals(read.queryIndexOf(1), 1);
        assertEquals(read.queryIndexOf(50), UmiRead.NO_POSITION);
        assertEquals(read.queryIndexOf(60), UmiRead.NO_POSITION);
    }
}
