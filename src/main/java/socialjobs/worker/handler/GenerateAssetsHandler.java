package socialjobs.worker.handler;

import socialjobs.worker.dispatch.GenerateAssetsPayload;
import socialjobs.worker.dispatch.JobExecutionException;
import socialjobs.worker.dispatch.JobHandler;
import socialjobs.worker.dispatch.JobResult;
import socialjobs.worker.generation.ContentGenerator;
import socialjobs.worker.generation.GenerationException;
import socialjobs.worker.generation.GenerationRequest;
import socialjobs.worker.generation.SocialKit;
import socialjobs.worker.generation.SocialKitSchema;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.Lead;
import socialjobs.worker.model.OutputKey;
import socialjobs.worker.model.OutputRecord;
import socialjobs.worker.model.VerticalProfile;
import socialjobs.worker.repository.LeadRepository;
import socialjobs.worker.repository.OutputRepository;
import socialjobs.worker.repository.VerticalProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates a social content kit for an activity and stores it under (org, activity, multi).
 *
 * Retries of the same job write to the same output row, so a job that succeeds after
 * failed attempts still leaves exactly one output.
 */
public class GenerateAssetsHandler implements JobHandler<GenerateAssetsPayload> {

    private static final Logger log = LoggerFactory.getLogger(GenerateAssetsHandler.class);

    private static final String DEFAULT_LOCALE = "es";

    private final VerticalProfileRepository profiles;
    private final LeadRepository leads;
    private final OutputRepository outputs;
    private final ContentGenerator generator;
    private final SocialPromptBuilder prompts;

    public GenerateAssetsHandler(VerticalProfileRepository profiles, LeadRepository leads,
            OutputRepository outputs, ContentGenerator generator) {
        this.profiles = profiles;
        this.leads = leads;
        this.outputs = outputs;
        this.generator = generator;
        this.prompts = new SocialPromptBuilder();
    }

    @Override
    public String jobType() {
        return GenerateAssetsPayload.JOB_TYPE;
    }

    @Override
    public Class<GenerateAssetsPayload> payloadType() {
        return GenerateAssetsPayload.class;
    }

    @Override
    public JobResult handle(JobRecord job, GenerateAssetsPayload payload, String traceId)
            throws JobExecutionException {
        String orgId = firstPresent(job.orgId(), payload.resolve(payload.orgId(), "org_id"));
        String activityId = firstPresent(job.activityId(), payload.resolve(payload.activityId(), "activity_id"));
        if (orgId == null || activityId == null) {
            throw new JobExecutionException("Missing upstream context: org_id and activity_id are required");
        }
        OutputKey key = new OutputKey(orgId, activityId, OutputKey.CHANNEL_MULTI);

        String leadId = firstPresent(job.leadId(), payload.resolve(payload.leadId(), "lead_id"));
        Lead lead = null;
        if (leadId != null) {
            lead = leads.findById(orgId, leadId)
                    .orElseThrow(() -> new JobExecutionException(
                            "Missing upstream context: lead " + leadId + " not found in org " + orgId));
        }

        String verticalKey = firstPresent(payload.resolve(payload.verticalKey(), "vertical_key"),
                VerticalProfile.GENERAL);
        VerticalProfile profile = profiles.resolve(verticalKey);

        String leadName = payload.resolve(payload.leadName(), "lead_name");
        if (leadName == null && lead != null) {
            leadName = lead.name();
        }
        SocialPromptBuilder.Context ctx = new SocialPromptBuilder.Context(
                verticalKey,
                firstPresent(payload.resolve(payload.locale(), "locale"), DEFAULT_LOCALE),
                leadName,
                payload.resolve(payload.topic(), "topic"),
                payload.resolve(payload.offer(), "offer"),
                payload.resolve(payload.brief(), "brief"),
                lead);
        GenerationRequest request = prompts.build(profile, ctx, SocialKitSchema.INSTANCE, traceId);

        long started = System.nanoTime();
        SocialKit kit;
        try {
            kit = generator.generate(request, SocialKitSchema.INSTANCE);
        } catch (GenerationException e) {
            throw new JobExecutionException(e.getMessage(), e);
        }
        long generationMs = (System.nanoTime() - started) / 1_000_000;

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("model", generator.model());
        meta.put("trace_id", traceId);
        meta.put("job_id", job.id());
        meta.put("activity_id", activityId);
        meta.put("vertical_key_used", profile.verticalKey());
        meta.put("profile_version", profile.version() != null ? profile.version().toString() : null);
        meta.put("dry_run", generator.dryRun());
        meta.put("generation_ms", generationMs);

        OutputRecord stored = outputs.upsert(new OutputRecord(
                null, key, leadId, verticalKey, OutputRecord.STATUS_DRAFT,
                kit.title(), kit.hook(), kit.caption(), kit.cta(), kit.hashtags(), kit.imagePrompts(),
                meta, null, null));

        log.info("Stored output {} for {} ({} ms, profile {})", stored.id(), key, generationMs, profile.verticalKey());
        return new JobResult(stored.id(), traceId);
    }

    private static String firstPresent(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }
}
