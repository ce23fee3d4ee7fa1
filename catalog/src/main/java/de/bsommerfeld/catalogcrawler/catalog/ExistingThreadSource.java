package de.bsommerfeld.catalogcrawler.catalog;

import java.util.List;

/**
 * Paginated read access to the thread ids the catalog already holds.
 */
@FunctionalInterface
public interface ExistingThreadSource {

    /**
     * Returns up to {@code limit} ids starting at {@code offset}. A page
     * shorter than {@code limit} is the last one.
     */
    List<String> fetchPage(int limit, int offset) throws CatalogException;
}
