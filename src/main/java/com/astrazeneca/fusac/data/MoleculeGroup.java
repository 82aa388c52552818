package com.astrazeneca.fusac.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads of one molecule split by molecule strand.
 */
public class MoleculeGroup {
    private final List<UmiRead> forwardReads = new ArrayList<>();
    private final List<UmiRead> reverseReads = new ArrayList<>();

    public void add(MoleculeStrand strand, UmiRead read) {
        if (strand == MoleculeStrand.FORWARD_MOLECULE) {
            forwardReads.add(read);
        } else {
            reverseReads.add(read);
        }
    }

    public List<UmiRead> getForwardReads() {
        return Collections.unmodifiableList(forwardReads);
    }

    public List<UmiRead> getReverseReads() {
        return Collections.unmodifiableList(reverseReads);
    }

    /**
     * @return true if both strands of the molecule were sequenced
     */
    public boolean isPaired() {
        return !forwardReads.isEmpty() && !reverseReads.isEmpty();
    }

    public boolean isEmpty() {
        return forwardReads.isEmpty() && reverseReads.isEmpty();
    }
}
