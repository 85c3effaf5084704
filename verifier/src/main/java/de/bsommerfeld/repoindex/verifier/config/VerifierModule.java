package de.bsommerfeld.repoindex.verifier.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.repoindex.verifier.transport.HttpIndexTransport;
import de.bsommerfeld.repoindex.verifier.transport.IndexTransport;

/**
 * Guice wiring for index downloads.
 */
public class VerifierModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(IndexTransport.class).to(HttpIndexTransport.class);
    }
}
