package socialjobs.worker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import socialjobs.worker.api.Controller;
import socialjobs.worker.api.v1.dto.HealthResponse;
import socialjobs.worker.model.JobStatus;
import socialjobs.worker.repository.JobRepository;
import socialjobs.worker.scheduler.WorkerLoop;
import socialjobs.worker.server.RouterHandler;
import socialjobs.worker.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final Database database;
    private final JobRepository jobs;
    private final WorkerLoop loop;

    public HealthController(Database database, JobRepository jobs, WorkerLoop loop) {
        this.database = database;
        this.jobs = jobs;
        this.loop = loop;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    loop.workerId(),
                    loop.state().name().toLowerCase(),
                    formatUptime(),
                    jobs.countByStatus(JobStatus.QUEUED),
                    jobs.countByStatus(JobStatus.RUNNING),
                    loop.completedCount(),
                    loop.retriedCount(),
                    loop.failedCount());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unhealthy(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private ControllerResponse unhealthy(String reason) throws Exception {
        HealthResponse response = HealthResponse.unhealthy(loop.workerId(), reason);
        return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
