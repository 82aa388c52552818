package com.astrazeneca.fusac.data;

import htsjdk.variant.variantcontext.VariantContext;

/**
 * Result of processing of one variant record ready to be written. Site and support are null for records
 * passed through unannotated.
 */
public class AnnotatedRecord {
    public final VariantContext record;
    public final VariantSite site;
    public final PositionSupport support;
    public final boolean ffpe;

    public AnnotatedRecord(VariantContext record, VariantSite site, PositionSupport support, boolean ffpe) {
        this.record = record;
        this.site = site;
        this.support = support;
        this.ffpe = ffpe;
    }

    public static AnnotatedRecord unannotated(VariantContext record) {
        return new AnnotatedRecord(record, null, null, false);
    }

    public boolean isAnnotated() {
        return support != null;
    }
}
