package com.umitunal.cronlite;

import com.umitunal.cronlite.admin.JobAdminService;
import com.umitunal.cronlite.config.EngineConfig;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.delivery.DeliveryChannel;
import com.umitunal.cronlite.delivery.DeliveryRouter;
import com.umitunal.cronlite.delivery.LoggingDeliveryChannel;
import com.umitunal.cronlite.lease.LeaseManager;
import com.umitunal.cronlite.schedule.ScheduleCalculator;
import com.umitunal.cronlite.worker.ExecutionRunner;
import com.umitunal.cronlite.worker.HandlerRegistry;
import com.umitunal.cronlite.worker.JobHandler;
import com.umitunal.cronlite.worker.NamedThreadFactory;
import com.umitunal.cronlite.worker.StoreRetry;
import com.umitunal.cronlite.worker.TickDriver;
import com.umitunal.cronlite.worker.TickSummary;
import com.umitunal.cronlite.worker.TimerDriver;
import com.umitunal.cronlite.worker.TriggerDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires store, leases, runner and one trigger driver into a worker.
 * <p>
 * The engine does not own the store; whoever opened it closes it after the engine.
 */
public class SchedulerEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    private final JobStore store;
    private final EngineConfig config;
    private final HandlerRegistry handlers;
    private final JobAdminService admin;
    private final LeaseManager leaseManager;
    private final ExecutionRunner runner;
    private final ExecutorService executionPool;
    private final TriggerDriver driver;

    private SchedulerEngine(Builder builder) {
        this.store = builder.store;
        this.config = builder.config;
        this.handlers = builder.handlers;

        ScheduleCalculator calculator = new ScheduleCalculator();
        this.admin = new JobAdminService(store, calculator, builder.clock);
        this.leaseManager = new LeaseManager(store, config.getWorkerId(), config.getLeaseDuration(), builder.clock);
        this.runner = new ExecutionRunner(handlers, leaseManager, store, calculator,
                new DeliveryRouter(builder.deliveryChannel), config, builder.clock);

        // No queue: a run either gets a thread now or its lease is handed back
        this.executionPool = new ThreadPoolExecutor(config.getExecutionThreads(), config.getMaxConcurrentRuns(),
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new NamedThreadFactory("cronlite-exec", false));

        StoreRetry storeRetry = new StoreRetry(config.getStoreRetryAttempts(), config.getStoreRetryBackoff());
        if (builder.mode == Mode.TIMER) {
            TimerDriver timerDriver = new TimerDriver(store, leaseManager, runner, executionPool, storeRetry,
                    builder.clock, config.getTickInterval());
            admin.addListener(timerDriver);
            this.driver = timerDriver;
        } else {
            this.driver = new TickDriver(store, leaseManager, runner, executionPool, storeRetry, builder.clock);
        }
    }

    public static Builder builder(JobStore store) {
        return new Builder(store);
    }

    /**
     * Start the driver. A tick engine only runs when {@link #tick()} is called.
     */
    public void start() {
        driver.start();
        log.info("Scheduler engine started: {} with handlers {}", config, handlers.kinds());
    }

    public TickSummary tick() {
        return driver.runOnceCycle();
    }

    public void registerHandler(String kind, JobHandler handler) {
        handlers.register(kind, handler);
    }

    public JobAdminService admin() { return admin; }
    public JobStore store() { return store; }
    public TriggerDriver driver() { return driver; }
    public LeaseManager leaseManager() { return leaseManager; }
    public HandlerRegistry handlers() { return handlers; }
    public EngineConfig config() { return config; }

    @Override
    public void close() {
        driver.close();
        executionPool.shutdown();
        try {
            if (!executionPool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Runs still active at shutdown; their leases will lapse");
                executionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        runner.close();
    }

    /**
     * How due jobs are found.
     */
    public enum Mode {
        /** External timer calls {@link #tick()}. */
        TICK,
        /** In-process timers per job. */
        TIMER
    }

    public static class Builder {
        private final JobStore store;
        private EngineConfig config = EngineConfig.defaults();
        private HandlerRegistry handlers = new HandlerRegistry();
        private DeliveryChannel deliveryChannel = new LoggingDeliveryChannel();
        private Clock clock = Clock.systemUTC();
        private Mode mode = Mode.TICK;

        private Builder(JobStore store) {
            this.store = store;
        }

        public Builder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withHandlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder withDeliveryChannel(DeliveryChannel channel) {
            this.deliveryChannel = channel;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Default: TICK
         */
        public Builder withMode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public SchedulerEngine build() {
            return new SchedulerEngine(this);
        }
    }
}
