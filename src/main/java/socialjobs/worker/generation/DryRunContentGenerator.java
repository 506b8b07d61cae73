package socialjobs.worker.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Deterministic placeholder content, used with AI_DRY_RUN=1.
 * The placeholder still goes through the schema so dry runs exercise the same validation.
 */
public class DryRunContentGenerator implements ContentGenerator {

    private final ObjectMapper mapper;
    private final String model;

    public DryRunContentGenerator(ObjectMapper mapper, String model) {
        this.mapper = mapper;
        this.model = model;
    }

    @Override
    public <T> T generate(GenerationRequest request, OutputSchema<T> schema) throws GenerationException {
        String vertical = request.verticalKey() == null ? "general" : request.verticalKey();

        ObjectNode kit = mapper.createObjectNode();
        kit.put("title", "Draft " + vertical + " (dry-run)");
        kit.put("hook", "Hook de prueba para " + vertical);
        kit.put("caption", "Caption de prueba para " + vertical + ".");
        kit.putArray("hashtags")
                .add("#ai360plus").add("#socialengine").add("#draft")
                .add("#automation").add("#crm").add("#growth");
        kit.put("cta", "¿Quieres que lo dejemos listo para publicar?");
        kit.putArray("image_prompts")
                .add("High-quality realistic business scene related to " + vertical
                        + ", modern minimal style, neutral background")
                .add("Close-up of a laptop dashboard UI representing CRM and automation, realistic lighting, no text")
                .add("Professional team meeting, modern office, optimistic mood, realistic photo, no text");

        return schema.conform(kit);
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public boolean dryRun() {
        return true;
    }
}
