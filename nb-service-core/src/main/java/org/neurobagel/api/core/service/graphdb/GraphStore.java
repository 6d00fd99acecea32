package org.neurobagel.api.core.service.graphdb;

import java.util.List;

import org.neurobagel.api.core.exception.QueryException;
import org.neurobagel.api.core.exception.UnauthorizedException;
import org.neurobagel.api.core.pojo.SubjectQuery;
import org.neurobagel.api.core.pojo.SubjectRow;

/**
 * Defines the functions required from the external graph store holding the dataset, subject and session facts.
 */
public interface GraphStore {

    /**
     * Runs a subject query against the graph store.
     *
     * @param query the query to execute
     * @return the matching subject rows in store order, empty if nothing matched
     * @throws UnauthorizedException if the store rejects the service credentials
     * @throws QueryException if the store cannot be reached or fails to execute the query
     */
    List<SubjectRow> querySubjects(SubjectQuery query);

    /**
     * Checks whether the graph store backend is reachable and operational.
     *
     * @return {@code true} if the backend is healthy, {@code false} otherwise
     */
    default boolean isHealthy() {
        return true;
    }

    /**
     * Returns where the store is queried, for diagnostics.
     *
     * @return the query endpoint location
     */
    default String getLocation() {
        return "unknown";
    }

}
