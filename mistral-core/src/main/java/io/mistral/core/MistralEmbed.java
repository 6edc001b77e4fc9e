package io.mistral.core;

import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.mistral.commons.config.Config;
import io.mistral.commons.config.ConfigFactory;
import io.mistral.core.database.DataSourceProvider;
import io.mistral.core.database.DatabaseModule;
import io.mistral.core.scheduler.Scheduler;
import io.mistral.core.scheduler.SchedulerModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the object graph of the scheduling core from a system configuration and
 * owns its lifecycle.
 *
 * <pre>
 * try (MistralEmbed embed = new MistralEmbed.Bootstrap().withSystemConfig(config).initialize()) {
 *     embed.getInjector().getInstance(JobFunctionRegistry.class).registerFunction("notify", ...);
 *     embed.start();
 *     embed.getScheduler().schedule(job);
 * }
 * </pre>
 */
public class MistralEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(MistralEmbed.class);

    public static class Bootstrap
    {
        private Config systemConfig;
        private final List<Module> additionalModules = new ArrayList<>();

        public Bootstrap withSystemConfig(Config systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap addModules(Module... modules)
        {
            for (Module module : modules) {
                additionalModules.add(module);
            }
            return this;
        }

        public MistralEmbed initialize()
        {
            Config config = systemConfig;
            if (config == null) {
                config = new ConfigFactory(ConfigFactory.defaultObjectMapper()).create();
            }
            return new MistralEmbed(config, additionalModules);
        }
    }

    private final Injector injector;
    private boolean started = false;

    private MistralEmbed(Config systemConfig, List<Module> additionalModules)
    {
        List<Module> modules = new ArrayList<>();
        modules.add(new ObjectMapperModule()
                .registerModule(new GuavaModule())
                .registerModule(new JavaTimeModule()));
        modules.add(new DatabaseModule());
        modules.add(new SchedulerModule());
        modules.add((binder) -> {
            binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
            binder.bind(Config.class).toInstance(systemConfig);
        });
        modules.addAll(additionalModules);
        this.injector = Guice.createInjector(modules);
    }

    public Injector getInjector()
    {
        return injector;
    }

    public Scheduler getScheduler()
    {
        return injector.getInstance(Scheduler.class);
    }

    /**
     * Migrates the database schema if database.migrate is enabled, and starts the scheduler.
     */
    public synchronized void start()
    {
        if (started) {
            return;
        }
        injector.getInstance(DatabaseModule.AutoMigrator.class).migrate();
        getScheduler().start();
        started = true;
    }

    @Override
    public synchronized void close()
    {
        try {
            getScheduler().close();
            started = false;
        }
        finally {
            try {
                injector.getInstance(DataSourceProvider.class).close();
            }
            catch (RuntimeException ex) {
                logger.warn("Failed to close the data source", ex);
            }
        }
    }
}
