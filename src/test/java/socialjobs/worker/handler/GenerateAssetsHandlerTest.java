package socialjobs.worker.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import socialjobs.worker.dispatch.GenerateAssetsPayload;
import socialjobs.worker.dispatch.JobExecutionException;
import socialjobs.worker.dispatch.JobPayloadDecoder;
import socialjobs.worker.dispatch.JobResult;
import socialjobs.worker.generation.GenerationRequest;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.Lead;
import socialjobs.worker.model.OutputKey;
import socialjobs.worker.model.OutputRecord;
import socialjobs.worker.model.VerticalProfile;
import socialjobs.worker.store.Database;
import socialjobs.worker.store.JdbcLeadRepository;
import socialjobs.worker.store.JdbcOutputRepository;
import socialjobs.worker.store.JdbcVerticalProfileRepository;
import socialjobs.worker.testing.ScriptedContentGenerator;
import socialjobs.worker.testing.TestDb;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerateAssetsHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Database db;
    private static JdbcVerticalProfileRepository profiles;
    private static JdbcLeadRepository leads;
    private static JdbcOutputRepository outputs;

    private ScriptedContentGenerator generator;
    private GenerateAssetsHandler handler;

    @BeforeAll
    static void setupDb() {
        db = TestDb.open("handler");
        profiles = new JdbcVerticalProfileRepository(db, MAPPER);
        leads = new JdbcLeadRepository(db);
        outputs = new JdbcOutputRepository(db, MAPPER);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        TestDb.clear(db);
        generator = new ScriptedContentGenerator();
        handler = new GenerateAssetsHandler(profiles, leads, outputs, generator);
    }

    private GenerateAssetsPayload payload(String json) throws JobExecutionException {
        return (GenerateAssetsPayload) new JobPayloadDecoder(MAPPER).decode("generate_assets", json);
    }

    @Test
    void writesNormalizedKitWithMeta() throws Exception {
        profiles.save(new VerticalProfile("dental", "Eres experto dental", "Clínica", "cercano", "familias",
                "{}", List.of("luz natural"), List.of("#sonrisa"), List.of("Pide cita"),
                Instant.parse("2025-01-01T00:00:00Z")), true);
        JobRecord job = JobRecord.builder().id("job-1").orgId("org-1").activityId("act-1")
                .jobType("generate_assets").build();

        JobResult result = handler.handle(job, payload("{\"vertical_key\":\"dental\",\"topic\":\"blanqueamiento\"}"),
                "trace-1");

        OutputRecord stored = outputs.findByKey(new OutputKey("org-1", "act-1", "multi")).orElseThrow();
        assertEquals(result.outputId(), stored.id());
        assertEquals("trace-1", result.traceId());
        assertEquals(List.of("#spring", "#promo"), stored.hashtags());
        assertEquals(List.of("sunlit storefront", "flowers on a desk"), stored.imagePrompts());
        assertEquals("dental", stored.verticalKey());
        assertEquals("draft", stored.status());
        assertEquals("scripted-model", stored.meta().get("model"));
        assertEquals("dental", stored.meta().get("vertical_key_used"));
        assertEquals("2025-01-01T00:00:00Z", stored.meta().get("profile_version"));
        assertEquals("job-1", stored.meta().get("job_id"));
        assertEquals(Boolean.FALSE, stored.meta().get("dry_run"));

        GenerationRequest request = generator.requests().get(0);
        assertEquals("Eres experto dental", request.systemInstructions());
        assertTrue(request.userContext().contains("VERTICAL: dental"));
        assertTrue(request.userContext().contains("#sonrisa"));
        assertTrue(request.userContext().contains("blanqueamiento"));
        assertEquals("trace-1", request.traceId());
    }

    @Test
    void fallsBackToGeneralProfile() throws Exception {
        profiles.save(new VerticalProfile(VerticalProfile.GENERAL, "General prompt", null, null, null, null,
                List.of(), List.of(), List.of(), Instant.parse("2025-02-01T00:00:00Z")), true);
        JobRecord job = JobRecord.builder().id("job-2").orgId("org-1").activityId("act-2")
                .jobType("generate_assets").build();

        handler.handle(job, payload("{\"vertical_key\":\"bakery\"}"), "trace-2");

        OutputRecord stored = outputs.findByKey(new OutputKey("org-1", "act-2", "multi")).orElseThrow();
        assertEquals("bakery", stored.verticalKey());
        assertEquals("general", stored.meta().get("vertical_key_used"));
        assertEquals("General prompt", generator.requests().get(0).systemInstructions());
    }

    @Test
    void keyFieldsComeFromPayloadWhenRowLacksThem() throws Exception {
        JobRecord job = JobRecord.builder().id("job-3").jobType("generate_assets").build();

        handler.handle(job, payload("{\"org_id\":\"org-7\",\"meta\":{\"activity_id\":\"act-7\"}}"), "trace-3");

        assertTrue(outputs.findByKey(new OutputKey("org-7", "act-7", "multi")).isPresent());
    }

    @Test
    void missingActivityIsAFailure() {
        JobRecord job = JobRecord.builder().id("job-4").orgId("org-1").jobType("generate_assets").build();

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> handler.handle(job, payload("{}"), "trace-4"));
        assertTrue(e.getMessage().contains("activity_id"));
        assertTrue(generator.requests().isEmpty());
    }

    @Test
    void unknownLeadIsAFailure() {
        JobRecord job = JobRecord.builder().id("job-5").orgId("org-1").activityId("act-5").leadId("ghost")
                .jobType("generate_assets").build();

        assertThrows(JobExecutionException.class, () -> handler.handle(job, payload("{}"), "trace-5"));
        assertTrue(generator.requests().isEmpty());
    }

    @Test
    void knownLeadFeedsPrompt() throws Exception {
        leads.save(new Lead("lead-1", "org-1", "Ana", "Panadería Sol", "Valencia", null, "web"));
        JobRecord job = JobRecord.builder().id("job-6").orgId("org-1").activityId("act-6").leadId("lead-1")
                .jobType("generate_assets").build();

        handler.handle(job, payload("{}"), "trace-6");

        String prompt = generator.requests().get(0).userContext();
        assertTrue(prompt.contains("lead_name: Ana"));
        assertTrue(prompt.contains("Panadería Sol"));
        assertEquals("lead-1", outputs.findByKey(new OutputKey("org-1", "act-6", "multi")).orElseThrow().leadId());
    }

    @Test
    void generationFailureWritesNothing() {
        generator.failNext("OpenAI error 503");
        JobRecord job = JobRecord.builder().id("job-7").orgId("org-1").activityId("act-7")
                .jobType("generate_assets").build();

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> handler.handle(job, payload("{}"), "trace-7"));

        assertTrue(e.getMessage().contains("OpenAI error 503"));
        assertTrue(outputs.findByKey(new OutputKey("org-1", "act-7", "multi")).isEmpty());
    }
}
