package socialjobs.worker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import socialjobs.worker.api.Controller;
import socialjobs.worker.api.v1.dto.JobResponse;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.repository.JobRepository;
import socialjobs.worker.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only job inspection.
 * GET /api/v1/jobs/{jobId}
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final JobRepository jobs;

    public JobController(JobRepository jobs) {
        this.jobs = jobs;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = JOB_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown job endpoint");
        }
        String jobId = matcher.group(1);

        try {
            Optional<JobRecord> job = jobs.findById(jobId);
            if (job.isEmpty()) {
                return ControllerResponse.notFound("job not found: " + jobId);
            }
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
        } catch (Exception e) {
            log.error("Failed to load job {}", jobId, e);
            return ControllerResponse.error("internal error");
        }
    }
}
