package org.neurobagel.api.graphdb.service;

import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.neurobagel.api.core.service.graphdb.CredentialProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Caches the graph store token shared by all requests. Readers share the read lock; a refresh holds the
 * write lock, and is skipped when another thread already replaced the rejected token.
 */
@Slf4j
public class TokenCredentialProvider implements CredentialProvider {

    private final StoreTokenClient tokenClient;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private String token;

    public TokenCredentialProvider(StoreTokenClient tokenClient) {
        this.tokenClient = tokenClient;
    }

    @Override
    public String getCredential() {
        lock.readLock().lock();
        try {
            if (token != null) {
                return token;
            }
        } finally {
            lock.readLock().unlock();
        }
        return refreshCredential(null);
    }

    @Override
    public String refreshCredential(String rejected) {
        lock.writeLock().lock();
        try {
            if (token != null && !token.equals(rejected)) {
                return token;
            }
            log.info("refreshCredential; requesting a new graph store token");
            token = null;
            token = tokenClient.fetchToken();
            return token;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
