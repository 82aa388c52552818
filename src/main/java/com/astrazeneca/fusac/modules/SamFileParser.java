package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.ReadSource;
import com.astrazeneca.fusac.data.UmiRead;
import com.astrazeneca.fusac.data.VariantSite;
import com.astrazeneca.fusac.data.scopedata.Scope;

import java.util.List;

/**
 * First step of the pipeline: fetches reads overlapping the variant site.
 */
public class SamFileParser implements Module<VariantSite, List<UmiRead>> {
    private final ReadSource readSource;

    public SamFileParser(ReadSource readSource) {
        this.readSource = readSource;
    }

    @Override
    public Scope<List<UmiRead>> process(Scope<VariantSite> scope) {
        return new Scope<>(scope, readSource.fetch(scope.data));
    }
}
