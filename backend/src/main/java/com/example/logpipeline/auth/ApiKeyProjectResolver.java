package com.example.logpipeline.auth;

/**
 * Maps an ingest credential to the project every record from that caller belongs to.
 */
public interface ApiKeyProjectResolver {

    /**
     * @param credential raw {@code X-API-Key} header value
     * @return the project id the credential is valid for
     * @throws InvalidApiKeyException if the credential is missing, malformed or unknown
     */
    String resolveProjectFromCredential(String credential);
}
