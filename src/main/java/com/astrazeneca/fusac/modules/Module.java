package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.data.scopedata.Scope;

/**
 * Functional interface for all Modules of FUSAC (they are the steps of the record pipeline in AbstractMode).
 * @param <T> means input data needed on step (module)
 * @param <R> means output data that step (module) produces
 */
@FunctionalInterface
public interface Module<T, R> {

    Scope<R> process(Scope<T> scope);
}
