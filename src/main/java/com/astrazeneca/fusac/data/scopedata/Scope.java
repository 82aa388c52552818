package com.astrazeneca.fusac.data.scopedata;

import com.astrazeneca.fusac.data.VariantSite;
import htsjdk.variant.variantcontext.VariantContext;

/**
 * Common scope of data must be storing between steps of the record pipeline.
 * @param <T> data of current step of pipeline
 */
public class Scope<T> {

    public final VariantContext record;
    public final VariantSite site;

    public final T data;

    public Scope(VariantContext record, VariantSite site, T data) {
        this.record = record;
        this.site = site;
        this.data = data;
    }

    public Scope(Scope<?> inheritableScope, T data) {
        this(inheritableScope.record, inheritableScope.site, data);
    }
}
