package org.neurobagel.api.graphdb.service;

import org.neurobagel.api.core.service.graphdb.CredentialProvider;

/**
 * Always presents the same credential. Used with stores that do not check it, such as the embedded one.
 */
public class StaticCredentialProvider implements CredentialProvider {

    private final String credential;

    public StaticCredentialProvider(String credential) {
        this.credential = credential;
    }

    @Override
    public String getCredential() {
        return credential;
    }

    @Override
    public String refreshCredential(String rejected) {
        return credential;
    }
}
