package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.Configuration;
import com.astrazeneca.fusac.data.*;
import com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.astrazeneca.fusac.data.BaseSymbol.*;
import static com.astrazeneca.fusac.data.UmiReads.tally;
import static org.testng.Assert.*;

public class PositionAggregatorTest {
    private static final List<Character> REF = Collections.singletonList('T');
    private static final List<Character> ALT = Collections.singletonList('C');

    private final PositionAggregator aggregator = new PositionAggregator();
    private final StrandClassifier classifier = new StrandClassifier();

    @BeforeMethod
    public void setUp() {
        GlobalReadOnlyScope.init(new Configuration());
    }

    @AfterMethod
    public void cleanUp() {
        GlobalReadOnlyScope.clear();
    }

    private MoleculeCall paired(String umi, BaseTally forward, BaseTally reverse) {
        return new MoleculeCall(new MoleculeKey(umi, umi), forward, reverse,
                classifier.classify(forward, reverse, REF, ALT));
    }

    private MoleculeCall single(String umi, BaseTally forward, BaseTally reverse) {
        return new MoleculeCall(new MoleculeKey(umi, umi), forward, reverse, null);
    }

    @Test
    public void cleanConcordantPairSupportsReference() {
        PositionSupport support = aggregator.aggregate(
                Collections.singletonList(paired("AAA", tally(T), tally(T))), REF, ALT);

        assertEquals(support.reference('T').paired, 2);
        assertEquals(support.alternate('C').paired, 0);
        assertEquals(support.getMolecules(HitCategory.REFERENCE), 1);
        assertFalse(support.hasFfpeHits());
    }

    @Test
    public void mutationSupportsAlternate() {
        PositionSupport support = aggregator.aggregate(
                Collections.singletonList(paired("AAA", tally(C), tally(C))), REF, ALT);

        assertEquals(support.alternate('C').paired, 2);
        assertEquals(support.reference('T').paired, 0);
        assertEquals(support.getMolecules(HitCategory.MUTATION), 1);
    }

    @Test
    public void ffpeArtefactSupportsBothAlleles() {
        PositionSupport support = aggregator.aggregate(
                Collections.singletonList(paired("AAA", tally(C), tally(T))), REF, ALT);

        assertEquals(support.alternate('C').paired, 1);
        assertEquals(support.reference('T').paired, 1);
        assertEquals(support.getMolecules(HitCategory.FFPE), 1);
        assertTrue(support.hasFfpeHits());
    }

    @Test
    public void singletonContributesOnlyToSingleCounters() {
        PositionSupport support = aggregator.aggregate(Arrays.asList(
                single("AAA", tally(C), tally()),
                single("CCC", tally(), tally(T, T))), REF, ALT);

        assertEquals(support.alternate('C').toString(), "0:1:0");
        assertEquals(support.reference('T').toString(), "0:0:2");
        assertEquals(support.getPairedMolecules(), 0);
        assertFalse(support.hasFfpeHits());
    }

    @Test
    public void otherMoleculeIsCounted() {
        PositionSupport support = aggregator.aggregate(
                Collections.singletonList(paired("AAA", tally(GAP), tally(T))), REF, ALT);

        assertEquals(support.getMolecules(HitCategory.OTHER), 1);
        assertEquals(support.getPairedMolecules(), 1);
        assertEquals(support.reference('T').paired, 1);
    }

    @Test
    public void resultDoesNotDependOnOrderOfMolecules() {
        List<MoleculeCall> calls = new ArrayList<>(Arrays.asList(
                paired("AAA", tally(T), tally(T, T)),
                paired("CCC", tally(C), tally(C)),
                paired("GGG", tally(C, C), tally(T)),
                paired("TTT", tally(N), tally(GAP)),
                single("ACG", tally(C), tally()),
                single("TGC", tally(), tally(T, C))));
        PositionSupport expected = aggregator.aggregate(calls, REF, ALT);

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(calls, random);
            assertEquals(aggregator.aggregate(calls, REF, ALT), expected);
        }
        assertEquals(expected.alternate('C').toString(), "4:1:1");
        assertEquals(expected.reference('T').toString(), "4:0:1");
    }

    @Test
    public void eachCallStartsFromZero() {
        List<MoleculeCall> calls = Collections.singletonList(paired("AAA", tally(C), tally(C)));
        aggregator.aggregate(calls, REF, ALT);

        PositionSupport support = aggregator.aggregate(calls, REF, ALT);

        assertEquals(support.alternate('C').paired, 2);
        assertEquals(support.getPairedMolecules(), 1);
    }
}
