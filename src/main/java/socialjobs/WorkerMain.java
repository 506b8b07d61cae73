package socialjobs;

import socialjobs.worker.config.Dependencies;
import socialjobs.worker.config.WorkerConfig;
import socialjobs.worker.scheduler.WorkerLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process entry point of a social jobs worker.
 *
 * Runs the poll loop on the main thread. SIGTERM asks the loop to stop; the job in progress
 * is finished before the process exits.
 */
public final class WorkerMain {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {
    }

    public static void main(String[] args) {
        WorkerConfig config = WorkerConfig.fromEnv();
        CountDownLatch drained = new CountDownLatch(1);
        boolean failed = false;

        try (Dependencies deps = Dependencies.create(config)) {
            WorkerLoop loop = deps.workerLoop();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                loop.requestStop();
                try {
                    if (!drained.await(config.openAiTimeout().toSeconds() + 10, TimeUnit.SECONDS)) {
                        log.warn("Worker {} did not drain before shutdown", loop.workerId());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "social-worker-shutdown"));

            deps.startStatusServer();
            log.info("Worker {} polling (dryRun={})", loop.workerId(), config.dryRun());
            loop.run();
        } catch (RuntimeException e) {
            log.error("Worker failed", e);
            failed = true;
        } finally {
            drained.countDown();
        }
        if (failed) {
            System.exit(1);
        }
    }
}
