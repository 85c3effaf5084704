package de.bsommerfeld.repoindex.index.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.repoindex.core.config.ConfigLoader;
import de.bsommerfeld.repoindex.core.config.IndexConfig;
import de.bsommerfeld.repoindex.core.config.IndexOptions;
import de.bsommerfeld.repoindex.index.signing.JarSigningGateway;
import de.bsommerfeld.repoindex.index.signing.SigningGateway;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for an index run. The signing gateway is created lazily so
 * unsigned runs never touch the keystore.
 */
public class IndexModule extends AbstractModule {

    private final IndexConfig config;
    private final IndexOptions options;

    public IndexModule(IndexConfig config, IndexOptions options) {
        this.config = config;
        this.options = options;
    }

    public static IndexModule fromFile(Path configPath, IndexOptions options) {
        return new IndexModule(ConfigLoader.load(configPath), options);
    }

    @Override
    protected void configure() {
        bind(IndexConfig.class).toInstance(config);
        bind(IndexOptions.class).toInstance(options);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    SigningGateway signingGateway(IndexConfig config) {
        return JarSigningGateway.fromConfig(config);
    }
}
