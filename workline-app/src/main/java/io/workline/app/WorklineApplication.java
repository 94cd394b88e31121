package io.workline.app;

import io.workline.cli.CallCommand;
import io.workline.cli.CliContext;
import io.workline.cli.ConfigCommand;
import io.workline.cli.DeadLettersCommand;
import io.workline.cli.DrainCommand;
import io.workline.cli.PingCommand;
import io.workline.cli.ServeCommand;
import io.workline.cli.StatusCommand;
import io.workline.cli.WorklineCliCommand;
import io.workline.core.api.MetricsServer;
import io.workline.core.config.ConfigPaths;
import io.workline.core.config.ConfigService;
import io.workline.core.config.model.ProviderConfig;
import io.workline.core.config.model.StoreConfig;
import io.workline.core.config.model.WorklineConfig;
import io.workline.core.conversation.ConversationEngine;
import io.workline.core.conversation.ConversationSettings;
import io.workline.core.conversation.HeuristicUtteranceClassifier;
import io.workline.core.conversation.LlmConversationModel;
import io.workline.core.observability.PipelineMetrics;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.outbox.OkHttpWebhookTransport;
import io.workline.core.outbox.OutboxStore;
import io.workline.core.outbox.OutboxWorker;
import io.workline.core.pipeline.CallPipeline;
import io.workline.core.provider.LlmProvider;
import io.workline.core.provider.OpenAiCompatProvider;
import io.workline.core.provider.ProviderChain;
import io.workline.core.ratelimit.RateLimiter;
import io.workline.core.session.SessionStore;
import io.workline.core.store.InMemoryKeyValueStore;
import io.workline.core.store.KeyValueStore;
import io.workline.core.store.SqliteKeyValueStore;
import io.workline.core.timeline.TimelineAnalyzer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class WorklineApplication {
    private static final Logger LOG = LoggerFactory.getLogger(WorklineApplication.class);
    private static final String OPENAI_BASE = "https://api.openai.com/v1";

    private WorklineApplication() {
    }

    public static void main(String[] args) {
        Clock clock = Clock.systemUTC();
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        WorklineConfig config = loadConfig(configService, configPath);

        KeyValueStore store = buildStore(config.store(), clock);
        PipelineMetrics metrics = PipelineMetrics.prometheus();

        LlmProvider provider = new ProviderChain(
            config.provider().name(),
            configuredProviders(config.provider(), config.fallbackProvider())
        );
        ConversationSettings settings = config.conversation().toSettings();
        TimelineAnalyzer analyzer = new TimelineAnalyzer(config.timeline().toPolicy());
        ConversationEngine engine = new ConversationEngine(
            new LlmConversationModel(provider, settings.model()),
            new HeuristicUtteranceClassifier(),
            analyzer,
            settings,
            clock
        );

        DeliveryOutbox outbox = new DeliveryOutbox(
            new OutboxStore(
                store,
                Duration.ofSeconds(config.outbox().entryTtlSeconds()),
                Duration.ofSeconds(config.outbox().deadLetterTtlSeconds()),
                Duration.ofSeconds(config.outbox().leaseSeconds())
            ),
            new OkHttpWebhookTransport(Duration.ofSeconds(config.outbox().requestTimeoutSeconds())),
            config.outbox().backoff(),
            config.outbox().workerThreads(),
            clock,
            metrics
        );

        CallPipeline pipeline = new CallPipeline(
            new SessionStore(store, config.store().sessionTtl(), config.store().sessionMaxLifetime(), clock),
            new RateLimiter(store, config.rateLimit().window()),
            config.rateLimit().maxCallsPerWindow(),
            engine,
            analyzer,
            outbox,
            metrics,
            config.outbox().destinationUrl(),
            clock
        );

        CliContext context = new CliContext(
            pipeline,
            outbox,
            configService,
            configPath,
            port -> runServe(config, port, metrics, pipeline, outbox, store)
        );

        CommandLine commandLine = new CommandLine(new WorklineCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("drain", new DrainCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("dead-letters", new DeadLettersCommand(context));
        commandLine.addSubcommand("ping", new PingCommand(context));
        commandLine.addSubcommand("config", new ConfigCommand(context));

        int exitCode = commandLine.execute(args);
        outbox.close();
        System.exit(exitCode);
    }

    private static WorklineConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read config {}, using defaults: {}", configPath, e.getMessage());
            return WorklineConfig.defaults();
        }
    }

    private static KeyValueStore buildStore(StoreConfig storeConfig, Clock clock) {
        if (StoreConfig.MEMORY.equals(storeConfig.backend())) {
            LOG.warn("Using the in-memory store; sessions and queued deliveries are lost on exit");
            return new InMemoryKeyValueStore(clock);
        }
        if (!StoreConfig.SQLITE.equals(storeConfig.backend())) {
            throw new IllegalStateException("Unknown store backend: " + storeConfig.backend());
        }
        Path sqlitePath = ConfigPaths.expandHome(storeConfig.sqlitePath());
        try {
            return new SqliteKeyValueStore(sqlitePath, clock);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite store at " + sqlitePath, e);
        }
    }

    private static List<LlmProvider> configuredProviders(ProviderConfig... candidates) {
        List<LlmProvider> providers = new ArrayList<>();
        for (ProviderConfig providerConfig : candidates) {
            if (providerConfig == null) {
                continue;
            }
            if (!providerConfig.configured()) {
                LOG.warn("Provider {} has no API key; leaving it out of the chain", providerConfig.name());
                continue;
            }
            String apiBase = providerConfig.apiBase().isBlank() ? OPENAI_BASE : providerConfig.apiBase();
            providers.add(new OpenAiCompatProvider(
                providerConfig.name(),
                providerConfig.apiKey(),
                apiBase,
                Duration.ofSeconds(providerConfig.timeoutSeconds())
            ));
        }
        return providers;
    }

    private static int runServe(
        WorklineConfig config,
        int port,
        PipelineMetrics metrics,
        CallPipeline pipeline,
        DeliveryOutbox outbox,
        KeyValueStore store
    ) throws Exception {
        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        ScheduledExecutorService purger = Executors.newSingleThreadScheduledExecutor();
        long purgeInterval = config.store().purgeIntervalSeconds();
        try (MetricsServer server = new MetricsServer(port, config.server().host(), metrics, outbox, store);
             OutboxWorker worker = new OutboxWorker(
                 outbox,
                 config.outbox().batchSize(),
                 Duration.ofSeconds(config.outbox().drainIntervalSeconds())
             )) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                shutdown.countDown();
                try {
                    stopped.await(90, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            server.start();
            worker.start();
            purger.scheduleAtFixedRate(() -> purgeExpired(store), purgeInterval, purgeInterval, TimeUnit.SECONDS);
            purger.scheduleWithFixedDelay(() -> redeliverPending(pipeline), purgeInterval, purgeInterval, TimeUnit.SECONDS);
            System.out.println("Workline serving on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: GET /metrics, GET /healthz, GET /summary, GET /outbox/dead, POST /outbox/dead/{eventId}/requeue");
            shutdown.await();
            LOG.info("Shutdown requested; finishing in-flight deliveries");
        } finally {
            purger.shutdownNow();
            stopped.countDown();
        }
        return 0;
    }

    private static void redeliverPending(CallPipeline pipeline) {
        try {
            pipeline.redeliverPending();
        } catch (Exception e) {
            LOG.warn("Pending profile sweep failed: {}", e.getMessage());
        }
    }

    private static void purgeExpired(KeyValueStore store) {
        try {
            int purged = store.purgeExpired();
            if (purged > 0) {
                LOG.debug("Purged {} expired keys", purged);
            }
        } catch (Exception e) {
            LOG.warn("Store purge failed: {}", e.getMessage());
        }
    }
}
