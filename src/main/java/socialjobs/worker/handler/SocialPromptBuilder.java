package socialjobs.worker.handler;

import socialjobs.worker.generation.GenerationRequest;
import socialjobs.worker.generation.OutputSchema;
import socialjobs.worker.model.Lead;
import socialjobs.worker.model.VerticalProfile;

/**
 * Builds the generation prompt from the vertical profile and the activity context.
 */
public class SocialPromptBuilder {

    private static final String DEFAULT_TONE = "claro y accionable";
    private static final String DEFAULT_AUDIENCE = "general";
    private static final String DEFAULT_IMAGE_STYLE = "minimal, luz estudio, sin texto";
    private static final String NONE = "(none)";

    /**
     * Activity context the content is written for.
     */
    public record Context(String verticalKey, String locale, String leadName, String topic, String offer,
            String brief, Lead lead) {
    }

    public GenerationRequest build(VerticalProfile profile, Context ctx, OutputSchema<?> schema, String traceId) {
        String brandRules = profile.brandRules() == null || profile.brandRules().isBlank() ? "{}" : profile.brandRules();
        String imageStyle = profile.imageStyleRules().isEmpty()
                ? DEFAULT_IMAGE_STYLE
                : String.join("; ", profile.imageStyleRules());
        String prefix = profile.promptUserPrefix() == null ? "" : profile.promptUserPrefix();

        StringBuilder sb = new StringBuilder();
        if (!prefix.isBlank()) {
            sb.append(prefix.trim()).append("\n\n");
        }
        sb.append("VERTICAL: ").append(ctx.verticalKey()).append('\n');
        sb.append("TONO: ").append(orDefault(profile.tone(), DEFAULT_TONE)).append('\n');
        sb.append("AUDIENCIA: ").append(orDefault(profile.audience(), DEFAULT_AUDIENCE)).append('\n');
        sb.append("REGLAS DE MARCA (json): ").append(brandRules).append("\n\n");
        sb.append("ESTILO IMAGEN: ").append(imageStyle).append("\n\n");
        sb.append("SEED HASHTAGS: ").append(String.join(" ", profile.hashtagSeed())).append('\n');
        sb.append("CTA SUGERIDAS: ").append(String.join(" | ", profile.ctaLibrary())).append('\n');
        sb.append("\n---\nAhora genera contenido para esta actividad:\n\n");
        sb.append("Devuelve SOLO JSON con EXACTAMENTE estas claves:\n");
        sb.append(schema.describe()).append("\n\n");
        sb.append("Reglas:\n");
        sb.append("- Idioma: ").append("en".equalsIgnoreCase(ctx.locale()) ? "English" : "Spanish").append(".\n");
        sb.append("- Hashtags: 6 a 12 elementos, sin espacios raros. Usa los SEED HASHTAGS si son relevantes.\n");
        sb.append("- image_prompts: 3 a 6 prompts, cada prompt debe describir una imagen clara. Aplica el ESTILO IMAGEN.\n");
        sb.append("- No incluyas markdown. No incluyas comentarios. Solo JSON.\n\n");
        sb.append("Contexto:\n");
        sb.append("- lead_name: ").append(orDefault(ctx.leadName(), "(unknown)")).append('\n');
        if (ctx.lead() != null) {
            sb.append("- company: ").append(orDefault(ctx.lead().company(), NONE)).append('\n');
            sb.append("- city: ").append(orDefault(ctx.lead().city(), NONE)).append('\n');
        }
        sb.append("- topic: ").append(orDefault(ctx.topic(), NONE)).append('\n');
        sb.append("- offer: ").append(orDefault(ctx.offer(), NONE)).append('\n');
        sb.append("- brief: ").append(orDefault(ctx.brief(), NONE));

        return new GenerationRequest(profile.systemPromptOrDefault(), sb.toString(), ctx.verticalKey(), traceId);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
