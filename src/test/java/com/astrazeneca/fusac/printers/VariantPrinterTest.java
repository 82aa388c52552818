package com.astrazeneca.fusac.printers;

import com.astrazeneca.fusac.data.AnnotatedRecord;
import com.astrazeneca.fusac.data.FfpeScope;
import com.astrazeneca.fusac.data.PositionSupport;
import com.astrazeneca.fusac.data.VariantSite;
import com.astrazeneca.fusac.postprocessmodules.RecordAnnotator;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import htsjdk.variant.variantcontext.writer.VariantContextWriter;
import htsjdk.variant.vcf.*;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

public class VariantPrinterTest {

    private static VariantContext record() {
        return new VariantContextBuilder("test", "chr8", 100, 100,
                Arrays.asList(Allele.create("C", true), Allele.create("T", false))).make();
    }

    @Test
    public void extendHeaderAddsFilterAndFormatLines() {
        VCFHeader input = new VCFHeader(Collections.<VCFHeaderLine>emptySet(), Collections.singletonList("sample1"));

        VCFHeader header = VariantPrinter.extendHeader(input);

        assertTrue(header.hasFilterLine(RecordAnnotator.FFPE_FILTER));
        VCFFormatHeaderLine umi = header.getFormatHeaderLine(RecordAnnotator.UMI_FORMAT);
        assertNotNull(umi);
        assertEquals(umi.getType(), VCFHeaderLineType.String);
        assertEquals(umi.getCountType(), VCFHeaderLineCount.UNBOUNDED);
        assertNotNull(header.getFormatHeaderLine(RecordAnnotator.SUMI_FORMAT));
        assertEquals(header.getGenotypeSamples(), Collections.singletonList("sample1"));
        assertFalse(input.hasFilterLine(RecordAnnotator.FFPE_FILTER));
    }

    @Test
    public void printWritesEveryRecordAndCountsAnnotated() {
        VariantContextWriter writer = mock(VariantContextWriter.class);
        ByteArrayOutputStream csv = new ByteArrayOutputStream();
        VariantPrinter printer = new VariantPrinter(writer,
                new CsvSummaryPrinter(new PrintStream(csv), FfpeScope.STANDARD, 0, 100));
        VariantContext record = record();
        VariantSite site = VariantSite.of(record);
        PositionSupport support = new PositionSupport(site.refAlleles, site.altAlleles);

        printer.print(AnnotatedRecord.unannotated(record));
        printer.print(new AnnotatedRecord(record, site, support, false));
        printer.print(new AnnotatedRecord(record, site, support, true));
        printer.close();

        verify(writer, times(3)).add(record);
        verify(writer).close();
        assertEquals(printer.getPrinted(), 3);
        assertEquals(printer.getAnnotated(), 2);
        assertEquals(printer.getFfpe(), 1);
        assertEquals(csv.toString().split(System.lineSeparator()).length, 3);
    }
}
