package com.umitunal;

import com.umitunal.cronlite.SchedulerEngine;
import com.umitunal.cronlite.config.ConfigLoader;
import com.umitunal.cronlite.config.EngineConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.StoreUnavailableException;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.umitunal.cronlite.server.TickAuthenticator;
import com.umitunal.cronlite.server.TickEndpoint;
import com.umitunal.cronlite.storage.JobStoreFactory;
import com.umitunal.cronlite.worker.HandlerRegistry;
import com.umitunal.cronlite.worker.LogJobHandler;
import com.umitunal.cronlite.worker.TickLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Starts a scheduler worker.
 * <p>
 * Usage: {@code java -jar cronlite.jar [config.properties]}. With {@code cronlite.mode=timer}
 * the worker arms in-process timers; with {@code tick} it serves {@code POST /cron/tick} and,
 * if {@code cronlite.tick.loop=true}, also ticks itself.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        Path configFile = args.length > 0 ? Paths.get(args[0]) : null;
        ConfigLoader config = ConfigLoader.load(configFile);
        EngineConfig engineConfig = config.engineConfig();
        StorageConfig storageConfig = config.storageConfig();

        JobStore store;
        try {
            store = JobStoreFactory.open(storageConfig);
        } catch (StoreUnavailableException e) {
            log.error("Cannot open job store {}", storageConfig, e);
            System.exit(1);
            return;
        }

        HandlerRegistry handlers = new HandlerRegistry(config.strictHandlers());
        handlers.register(LogJobHandler.KIND, new LogJobHandler());

        SchedulerEngine.Mode mode = "timer".equals(config.mode()) ? SchedulerEngine.Mode.TIMER : SchedulerEngine.Mode.TICK;
        SchedulerEngine engine = SchedulerEngine.builder(store)
                .withConfig(engineConfig)
                .withHandlers(handlers)
                .withMode(mode)
                .build();

        TickEndpoint endpoint = null;
        TickLoop loop = null;
        try {
            engine.start();
            if (mode == SchedulerEngine.Mode.TICK) {
                endpoint = new TickEndpoint(config.httpPort(), engine.driver(),
                        new TickAuthenticator(config.tickSecret()), JsonCodec.createDefaultMapper(), Clock.systemUTC());
                endpoint.start();
                if (config.tickLoopEnabled()) {
                    loop = new TickLoop(engine.driver(), engineConfig.getTickInterval());
                    loop.start();
                }
            }
        } catch (IOException e) {
            log.error("Cannot start tick endpoint on port {}", config.httpPort(), e);
            engine.close();
            store.close();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        TickEndpoint runningEndpoint = endpoint;
        TickLoop runningLoop = loop;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            if (runningLoop != null) {
                runningLoop.stop();
            }
            if (runningEndpoint != null) {
                runningEndpoint.close();
            }
            engine.close();
            store.close();
            stopped.countDown();
        }, "cronlite-shutdown"));

        log.info("cronlite running in {} mode", mode);
        stopped.await();
    }
}
