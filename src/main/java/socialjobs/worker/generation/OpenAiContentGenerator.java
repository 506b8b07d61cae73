package socialjobs.worker.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Chat-completions client that asks for a JSON object reply.
 */
public class OpenAiContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiContentGenerator.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final double TEMPERATURE = 0.7;
    private static final int SNIPPET_LENGTH = 500;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;

    public OpenAiContentGenerator(ObjectMapper mapper, String apiKey, String baseUrl, String model, Duration timeout) {
        this(new OkHttpClient.Builder()
                        .callTimeout(timeout)
                        .readTimeout(timeout)
                        .build(),
                mapper, apiKey, baseUrl, model);
    }

    public OpenAiContentGenerator(OkHttpClient client, ObjectMapper mapper, String apiKey, String baseUrl, String model) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("OPENAI_API_KEY is required unless AI_DRY_RUN=1");
        }
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public <T> T generate(GenerationRequest request, OutputSchema<T> schema) throws GenerationException {
        Request.Builder http = new Request.Builder()
                .url(baseUrl + COMPLETIONS_PATH)
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(requestBody(request), JSON));
        if (request.traceId() != null) {
            http.addHeader("X-Request-Id", request.traceId());
        }

        String raw;
        try (Response resp = client.newCall(http.build()).execute()) {
            ResponseBody body = resp.body();
            raw = body != null ? body.string() : "";
            if (!resp.isSuccessful()) {
                if (resp.code() == 429) {
                    log.warn("OpenAI rate limited request {}", request.traceId());
                }
                throw new GenerationCallException("OpenAI error " + resp.code() + ": " + snippet(raw), resp.code());
            }
        } catch (IOException e) {
            throw new GenerationCallException("OpenAI call failed: " + e.getMessage(), e);
        }

        String content = messageContent(raw);
        JsonNode parsed;
        try {
            parsed = mapper.readTree(stripFence(content));
        } catch (JsonProcessingException e) {
            throw new MalformedOutputException("OpenAI content is not valid JSON: " + snippet(content), e);
        }
        return schema.conform(parsed);
    }

    private String requestBody(GenerationRequest request) throws GenerationCallException {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        root.put("temperature", TEMPERATURE);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", request.systemInstructions());
        messages.addObject().put("role", "user").put("content", request.userContext());
        root.putObject("response_format").put("type", "json_object");
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new GenerationCallException("Failed to encode OpenAI request", e);
        }
    }

    private String messageContent(String raw) throws GenerationCallException {
        JsonNode envelope;
        try {
            envelope = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new GenerationCallException("OpenAI returned non-JSON response: " + snippet(raw), e);
        }
        JsonNode content = envelope == null ? null : envelope.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new GenerationCallException("OpenAI response missing message.content: " + snippet(raw), 200);
        }
        return content.asText();
    }

    static String stripFence(String text) {
        String cleaned = text.trim();
        if (cleaned.regionMatches(true, 0, "```json", 0, 7)) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static String snippet(String text) {
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
    }
}
