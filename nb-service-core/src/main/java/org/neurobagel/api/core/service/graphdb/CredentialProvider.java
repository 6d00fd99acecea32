package org.neurobagel.api.core.service.graphdb;

import org.neurobagel.api.core.exception.UnauthorizedException;

/**
 * Supplies the bearer credential presented to the graph store. Implementations are shared across requests.
 */
public interface CredentialProvider {

    /**
     * Returns the current credential, obtaining one first if none is cached.
     *
     * @return the bearer credential
     * @throws UnauthorizedException if the configured secrets are rejected
     */
    String getCredential();

    /**
     * Replaces a credential the store has rejected. If another caller already replaced it, the
     * newer credential is returned without contacting the authentication provider again.
     *
     * @param rejected the credential the store rejected
     * @return a fresh credential
     * @throws UnauthorizedException if the configured secrets are rejected
     */
    String refreshCredential(String rejected);
}
