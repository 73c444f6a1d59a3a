package com.e2eq.pgraph.spi;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Bidirectional mapping between external pids and internal row ids. Over the rows that
 * exist, {@code pidToRowId(rowIdToPid(r)) == r} for every row id r.
 */
public interface IdentityTranslator {

    OptionalLong pidToRowId(String pid);

    Optional<String> rowIdToPid(long rowId);

    /**
     * Resolves many pids at once. Pids with no row are absent from the result.
     */
    Map<String, Long> resolveAll(Collection<String> pids);
}
