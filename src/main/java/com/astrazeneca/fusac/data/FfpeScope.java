package com.astrazeneca.fusac.data;

/**
 * Substitutions that may be flagged as FFPE artefacts.
 */
public enum FfpeScope {
    /** Only the C:G>T:A deamination signature */
    STANDARD,
    /** Every substitution */
    ALL;

    public boolean includes(char ref, char alt) {
        if (this == ALL) {
            return true;
        }
        char r = Character.toUpperCase(ref);
        char a = Character.toUpperCase(alt);
        return (r == 'C' && a == 'T') || (r == 'G' && a == 'A');
    }

    public boolean includes(VariantSite site) {
        for (char ref : site.refAlleles) {
            for (char alt : site.altAlleles) {
                if (includes(ref, alt)) {
                    return true;
                }
            }
        }
        return false;
    }
}
