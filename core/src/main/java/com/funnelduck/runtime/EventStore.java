package com.funnelduck.runtime;

import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.generator.CompiledQuery;
import java.util.List;
import java.util.Map;

/**
 * Executes compiled queries against the events database.
 *
 * <p>Implementations must bind {@link CompiledQuery#params()} as typed
 * parameters and must be safe to call from several threads at once.
 */
@FunctionalInterface
public interface EventStore {

    /**
     * Runs a query.
     *
     * @param query compiled SQL with its parameters
     * @return rows keyed by column label, in result order; arrays as {@link List}s
     * @throws QueryExecutionException if the store rejects or fails the query
     */
    List<Map<String, Object>> query(CompiledQuery query);
}
