package socialjobs.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import socialjobs.worker.api.v1.HealthController;
import socialjobs.worker.api.v1.JobController;
import socialjobs.worker.dispatch.JobDispatcher;
import socialjobs.worker.dispatch.JobPayloadDecoder;
import socialjobs.worker.generation.ContentGenerator;
import socialjobs.worker.generation.DryRunContentGenerator;
import socialjobs.worker.generation.OpenAiContentGenerator;
import socialjobs.worker.handler.GenerateAssetsHandler;
import socialjobs.worker.repository.AuditLog;
import socialjobs.worker.repository.JobRepository;
import socialjobs.worker.repository.LeadRepository;
import socialjobs.worker.repository.OutputRepository;
import socialjobs.worker.repository.VerticalProfileRepository;
import socialjobs.worker.scheduler.BackoffPolicy;
import socialjobs.worker.scheduler.Sleeper;
import socialjobs.worker.scheduler.WorkerLoop;
import socialjobs.worker.server.RouterHandler;
import socialjobs.worker.server.StatusServer;
import socialjobs.worker.store.Database;
import socialjobs.worker.store.JdbcAuditLog;
import socialjobs.worker.store.JdbcJobRepository;
import socialjobs.worker.store.JdbcLeadRepository;
import socialjobs.worker.store.JdbcOutputRepository;
import socialjobs.worker.store.JdbcVerticalProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the store, the generator, the dispatcher and the worker loop.
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(WorkerConfig.fromEnv())) {
 *     deps.startStatusServer();
 *     deps.workerLoop().run();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkerConfig config;
    private final ObjectMapper mapper;
    private final Database database;
    private final JobRepository jobRepository;
    private final OutputRepository outputRepository;
    private final VerticalProfileRepository profileRepository;
    private final LeadRepository leadRepository;
    private final AuditLog auditLog;
    private final ContentGenerator contentGenerator;
    private final JobDispatcher dispatcher;
    private final WorkerLoop workerLoop;

    // Status server (lazy-initialized)
    private StatusServer statusServer;

    private Dependencies(WorkerConfig config, ContentGenerator generator, Clock clock) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .findAndRegisterModules();

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database, clock, config.defaultMaxAttempts());
        this.outputRepository = new JdbcOutputRepository(database, mapper, clock);
        this.profileRepository = new JdbcVerticalProfileRepository(database, mapper);
        this.leadRepository = new JdbcLeadRepository(database);
        this.auditLog = config.hasSystemUser()
                ? new JdbcAuditLog(database, mapper, config.systemUserId(), clock)
                : AuditLog.noop();

        // Execution
        this.contentGenerator = generator != null ? generator : createGenerator(config, mapper);
        this.dispatcher = new JobDispatcher(new JobPayloadDecoder(mapper), List.of(
                new GenerateAssetsHandler(profileRepository, leadRepository, outputRepository, contentGenerator)));
        this.workerLoop = new WorkerLoop(
                config.workerId(),
                jobRepository,
                dispatcher,
                new BackoffPolicy(config.backoffBase(), config.backoffCap()),
                auditLog,
                new WorkerLoop.Timings(config.idleDelay(), config.errorDelay(), config.stuckAfter(),
                        config.reapInterval()),
                new Sleeper(),
                clock);

        log.info("Dependencies initialized (generator={}, dryRun={}, handlers={})",
                contentGenerator.model(), contentGenerator.dryRun(), dispatcher.supportedJobTypes());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(WorkerConfig config) {
        return new Dependencies(config, null, Clock.systemUTC());
    }

    /**
     * Create dependencies with a replacement content generator, used by tests.
     */
    public static Dependencies create(WorkerConfig config, ContentGenerator generator) {
        return new Dependencies(config, generator, Clock.systemUTC());
    }

    private static ContentGenerator createGenerator(WorkerConfig config, ObjectMapper mapper) {
        if (config.dryRun()) {
            return new DryRunContentGenerator(mapper, config.openAiModel());
        }
        if (!config.hasOpenAiApiKey()) {
            throw new IllegalStateException("OPENAI_API_KEY is not set and AI_DRY_RUN is off");
        }
        return new OpenAiContentGenerator(mapper, config.openAiApiKey(), config.openAiBaseUrl(),
                config.openAiModel(), config.openAiTimeout());
    }

    // Getters
    public WorkerConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public OutputRepository outputRepository() {
        return outputRepository;
    }

    public VerticalProfileRepository profileRepository() {
        return profileRepository;
    }

    public LeadRepository leadRepository() {
        return leadRepository;
    }

    public ContentGenerator contentGenerator() {
        return contentGenerator;
    }

    public JobDispatcher dispatcher() {
        return dispatcher;
    }

    public WorkerLoop workerLoop() {
        return workerLoop;
    }

    /**
     * Router with the status controllers registered.
     */
    public RouterHandler routerHandler() {
        return new RouterHandler()
                .registerController(new HealthController(database, jobRepository, workerLoop))
                .registerController(new JobController(jobRepository));
    }

    /**
     * Start the status endpoint if a port is configured.
     *
     * @return the bound port, or -1 when the endpoint is disabled
     */
    public int startStatusServer() {
        if (config.statusPort() <= 0) {
            log.info("Status endpoint disabled");
            return -1;
        }
        return startStatusServer(config.statusPort());
    }

    /**
     * Start the status endpoint on an explicit port; 0 picks a free one.
     */
    public synchronized int startStatusServer(int port) {
        if (statusServer == null) {
            statusServer = new StatusServer(routerHandler());
        }
        return statusServer.start(port);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        workerLoop.requestStop();

        if (statusServer != null) {
            try {
                statusServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping status server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
