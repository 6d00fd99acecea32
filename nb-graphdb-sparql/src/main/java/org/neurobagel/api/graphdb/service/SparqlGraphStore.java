package org.neurobagel.api.graphdb.service;

import java.net.http.HttpConnectTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.jena.atlas.web.HttpException;
import org.apache.jena.datatypes.DatatypeFormatException;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.sparql.engine.http.QueryExceptionHTTP;
import org.apache.jena.sparql.exec.http.QueryExecutionHTTP;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.exception.QueryException;
import org.neurobagel.api.core.exception.UnauthorizedException;
import org.neurobagel.api.core.pojo.SubjectQuery;
import org.neurobagel.api.core.pojo.SubjectRow;
import org.neurobagel.api.core.service.graphdb.CredentialProvider;
import org.neurobagel.api.core.service.graphdb.GraphStore;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link GraphStore} over a remote SPARQL 1.1 query endpoint, authenticated with a bearer credential.
 *
 * <p>When the store rejects the credential, it is refreshed and the query retried once. Every other
 * failure surfaces as a {@link QueryException}; there is no fallback to an empty result.</p>
 */
@Slf4j
@Component
public class SparqlGraphStore implements GraphStore {

    private static final String HEALTH_PROBE = "ASK {}";

    private final SparqlEndpoint endpoint;
    private final CredentialProvider credentialProvider;

    @Autowired
    public SparqlGraphStore(SparqlEndpoint endpoint, CredentialProvider credentialProvider) {
        this.endpoint = endpoint;
        this.credentialProvider = credentialProvider;
    }

    @Override
    public List<SubjectRow> querySubjects(SubjectQuery query) {
        log.debug("querySubjects.enter; got constraints: {}", query.constraints());
        String credential = credentialProvider.getCredential();
        List<SubjectRow> rows;
        try {
            rows = execute(query, credential);
        } catch (RuntimeException e) {
            if (!isAuthFailure(e)) {
                throw toQueryException(query, e);
            }
            log.info("querySubjects; graph store rejected the credential, refreshing it and retrying once");
            rows = retry(query, credentialProvider.refreshCredential(credential));
        }
        log.debug("querySubjects.exit; returning {} rows", rows.size());
        return rows;
    }

    @Override
    public boolean isHealthy() {
        try (QueryExecution qexec = newExecution(HEALTH_PROBE, credentialProvider.getCredential())) {
            return qexec.execAsk();
        } catch (RuntimeException e) {
            log.warn("isHealthy; graph store at {} is not available: {}", endpoint.queryUri(), e.getMessage());
            return false;
        }
    }

    @Override
    public String getLocation() {
        return endpoint.queryUri();
    }

    List<SubjectRow> execute(SubjectQuery query, String credential) {
        try (QueryExecution qexec = newExecution(query.text(), credential)) {
            ResultSet results = qexec.execSelect();
            List<SubjectRow> rows = new ArrayList<>();
            results.forEachRemaining(solution -> rows.add(toRow(solution)));
            return rows;
        }
    }

    private List<SubjectRow> retry(SubjectQuery query, String credential) {
        try {
            return execute(query, credential);
        } catch (RuntimeException e) {
            if (isAuthFailure(e)) {
                log.error("retry; graph store rejected the refreshed credential");
                throw new UnauthorizedException("graph store rejected the service credentials", e);
            }
            throw toQueryException(query, e);
        }
    }

    private QueryExecution newExecution(String queryText, String credential) {
        return QueryExecutionHTTP.service(endpoint.queryUri())
                .query(queryText)
                .httpHeader(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                .timeout(endpoint.timeoutSeconds(), TimeUnit.SECONDS)
                .build();
    }

    private QueryException toQueryException(SubjectQuery query, RuntimeException e) {
        if (e.getCause() instanceof HttpConnectTimeoutException) {
            log.error("Timeout while executing query: {}", query.text(), e);
            return new QueryException("Timeout while executing query", e);
        }
        log.error("Error while executing query: {}", query.text(), e);
        return new QueryException("error querying graph store: " + e.getMessage(), e);
    }

    static boolean isAuthFailure(RuntimeException e) {
        int status = -1;
        if (e instanceof QueryExceptionHTTP qe) {
            status = qe.getStatusCode();
        } else if (e instanceof HttpException he) {
            status = he.getStatusCode();
        }
        return status == 401 || status == 403;
    }

    private static SubjectRow toRow(QuerySolution solution) {
        return new SubjectRow(
                text(solution.get("dataset")),
                text(solution.get("dataset_name")),
                text(solution.get("sub_id")),
                text(solution.get("file_path")),
                text(solution.get("image_modal")),
                count(solution.get("num_sessions")));
    }

    private static String text(RDFNode node) {
        if (node == null) {
            return null;
        }
        if (node.isLiteral()) {
            return node.asLiteral().getLexicalForm();
        }
        if (node.isURIResource()) {
            return node.asResource().getURI();
        }
        return node.toString();
    }

    static Integer count(RDFNode node) {
        if (node == null || !node.isLiteral()) {
            return null;
        }
        Literal literal = node.asLiteral();
        try {
            return literal.getInt();
        } catch (DatatypeFormatException e) {
            log.warn("count; graph store returned a malformed session count '{}', leaving it unset",
                    literal.getLexicalForm());
            return null;
        }
    }
}
