package com.astrazeneca.fusac.data;

import com.astrazeneca.fusac.exception.UnsupportedVariantShapeException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class VariantSiteTest {

    @Test
    public void singleNucleotideSubstitution() {
        VariantSite site = VariantSite.of(record(100, "C", "T"));

        assertEquals(site.contig, "chr8");
        assertEquals(site.position, 100);
        assertEquals(site.position0, 99);
        assertEquals(site.getRef(), 'C');
        assertEquals(site.getAlt(), 'T');
        assertEquals(site.getMismatch(), "C>T");
    }

    @DataProvider(name = "unsupported")
    public Object[][] unsupported() {
        return new Object[][] {
                {"CA", new String[] {"C"}},
                {"C", new String[] {"CT"}},
                {"CA", new String[] {"TG"}},
                {"C", new String[] {"T", "G"}},
                {"C", new String[] {"<DEL>"}},
                {"C", new String[] {"*"}},
        };
    }

    @Test(dataProvider = "unsupported", expectedExceptions = UnsupportedVariantShapeException.class)
    public void notSubstitutionIsRejected(String ref, String[] alts) {
        VariantSite.of(record(100, ref, alts));
    }

    @Test
    public void ffpeScope() {
        assertEquals(FfpeScope.STANDARD.includes(new VariantSite("chr1", 1, 'C', 'T')), true);
        assertEquals(FfpeScope.STANDARD.includes(new VariantSite("chr1", 1, 'G', 'A')), true);
        assertEquals(FfpeScope.STANDARD.includes(new VariantSite("chr1", 1, 'T', 'C')), false);
        assertEquals(FfpeScope.ALL.includes(new VariantSite("chr1", 1, 'T', 'C')), true);
    }

    static VariantContext record(int position, String ref, String... alts) {
        List<Allele> alleles = new ArrayList<>();
        alleles.add(Allele.create(ref, true));
        for (String alt : alts) {
            alleles.add(Allele.create(alt, false));
        }
        return new VariantContextBuilder("test", "chr8", position, position + ref.length() - 1, alleles).make();
    }
}
