package io.mistral.core.scheduler;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.mistral.commons.config.Config;
import io.mistral.core.queue.PostTransactionQueue;
import io.mistral.core.scheduler.legacy.DelayedCallRecovery;
import io.mistral.core.scheduler.legacy.DelayedCallRecoveryConfig;
import io.mistral.core.scheduler.legacy.LegacyScheduler;

public class SchedulerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerConfig.class).toProvider(SchedulerConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DelayedCallRecoveryConfig.class).toProvider(DelayedCallRecoveryConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(JobFunctionRegistry.class).in(Scopes.SINGLETON);
        binder.bind(PostTransactionQueue.class).in(Scopes.SINGLETON);
        binder.bind(DefaultScheduler.class).in(Scopes.SINGLETON);
        binder.bind(LegacyScheduler.class).in(Scopes.SINGLETON);
        binder.bind(DelayedCallRecovery.class).in(Scopes.SINGLETON);
        binder.bind(Scheduler.class).toProvider(SchedulerProvider.class).in(Scopes.SINGLETON);
    }

    public static class SchedulerConfigProvider
            implements Provider<SchedulerConfig>
    {
        private final SchedulerConfig config;

        @Inject
        public SchedulerConfigProvider(Config systemConfig)
        {
            this.config = SchedulerConfig.convertFrom(systemConfig);
        }

        @Override
        public SchedulerConfig get()
        {
            return config;
        }
    }

    public static class DelayedCallRecoveryConfigProvider
            implements Provider<DelayedCallRecoveryConfig>
    {
        private final DelayedCallRecoveryConfig config;

        @Inject
        public DelayedCallRecoveryConfigProvider(Config systemConfig)
        {
            this.config = DelayedCallRecoveryConfig.convertFrom(systemConfig);
        }

        @Override
        public DelayedCallRecoveryConfig get()
        {
            return config;
        }
    }

    // scheduler.type selects the implementation
    public static class SchedulerProvider
            implements Provider<Scheduler>
    {
        private final SchedulerConfig config;
        private final Injector injector;

        @Inject
        public SchedulerProvider(SchedulerConfig config, Injector injector)
        {
            this.config = config;
            this.injector = injector;
        }

        @Override
        public Scheduler get()
        {
            switch (config.getType()) {
            case "legacy":
                return injector.getInstance(LegacyScheduler.class);
            default:
                return injector.getInstance(DefaultScheduler.class);
            }
        }
    }
}
