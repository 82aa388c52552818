package com.astrazeneca.fusac.data;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Support of reference and alternate alleles summed over all molecules at a variant position,
 * plus the number of paired molecules in each category.
 */
public class PositionSupport {
    private final Map<Character, SupportCounts> reference = new LinkedHashMap<>();
    private final Map<Character, SupportCounts> alternate = new LinkedHashMap<>();
    private final Map<HitCategory, Integer> molecules = new EnumMap<>(HitCategory.class);

    public PositionSupport(Collection<Character> refAlleles, Collection<Character> altAlleles) {
        for (Character allele : refAlleles) {
            reference.put(allele, new SupportCounts());
        }
        for (Character allele : altAlleles) {
            alternate.put(allele, new SupportCounts());
        }
        for (HitCategory category : HitCategory.values()) {
            molecules.put(category, 0);
        }
    }

    public Map<Character, SupportCounts> getReference() {
        return Collections.unmodifiableMap(reference);
    }

    public Map<Character, SupportCounts> getAlternate() {
        return Collections.unmodifiableMap(alternate);
    }

    public SupportCounts reference(char allele) {
        return reference.get(allele);
    }

    public SupportCounts alternate(char allele) {
        return alternate.get(allele);
    }

    public void addMolecule(HitCategory category) {
        molecules.merge(category, 1, Integer::sum);
    }

    public int getMolecules(HitCategory category) {
        return molecules.get(category);
    }

    public int getPairedMolecules() {
        int total = 0;
        for (int count : molecules.values()) {
            total += count;
        }
        return total;
    }

    public boolean hasFfpeHits() {
        return getMolecules(HitCategory.FFPE) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PositionSupport that = (PositionSupport) o;
        return Objects.equals(reference, that.reference) &&
                Objects.equals(alternate, that.alternate) &&
                Objects.equals(molecules, that.molecules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, alternate, molecules);
    }

    @Override
    public String toString() {
        return "PositionSupport [ref=" + reference + ", alt=" + alternate + ", molecules=" + molecules + "]";
    }
}
