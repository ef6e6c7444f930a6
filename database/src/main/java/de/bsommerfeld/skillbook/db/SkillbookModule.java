package de.bsommerfeld.skillbook.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.skillbook.core.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the persistence core.
 *
 * <p>
 * Binds the resolved {@link StoreConfig} and migrates the schema eagerly, so
 * {@code Guice.createInjector(new SkillbookModule())} either yields stores
 * that run against an up-to-date schema or fails. Stores, the position
 * manager and search bind themselves just-in-time via {@code @Singleton}.
 */
public class SkillbookModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(SkillbookModule.class);

    private final StoreConfig config;

    /** Resolves configuration from system properties and the environment. */
    public SkillbookModule() {
        this(StoreConfig.resolve());
    }

    public SkillbookModule(StoreConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.info("Database path: {}", config.getDatabasePath().toAbsolutePath());
        bind(StoreConfig.class).toInstance(config);

        // Migrate before anything else can touch the file
        bind(SchemaInitializer.class).asEagerSingleton();
    }
}
