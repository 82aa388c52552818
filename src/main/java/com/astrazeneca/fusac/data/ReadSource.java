package com.astrazeneca.fusac.data;

import java.util.List;

/**
 * Source of aligned reads overlapping a variant site. Implementations must be safe to call from several
 * worker threads at once.
 */
@FunctionalInterface
public interface ReadSource {

    List<UmiRead> fetch(VariantSite site);
}
