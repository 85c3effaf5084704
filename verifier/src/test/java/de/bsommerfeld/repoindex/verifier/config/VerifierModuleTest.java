package de.bsommerfeld.repoindex.verifier.config;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.repoindex.verifier.TrustVerifier;
import de.bsommerfeld.repoindex.verifier.transport.HttpIndexTransport;
import de.bsommerfeld.repoindex.verifier.transport.IndexTransport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerifierModuleTest {

    @Test
    void injector_shouldWireVerifierWithHttpTransport() {
        Injector injector = Guice.createInjector(new VerifierModule());

        assertInstanceOf(HttpIndexTransport.class, injector.getInstance(IndexTransport.class));
        assertSame(injector.getInstance(TrustVerifier.class), injector.getInstance(TrustVerifier.class));
    }
}
