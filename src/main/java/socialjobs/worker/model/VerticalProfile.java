package socialjobs.worker.model;

import java.time.Instant;
import java.util.List;

/**
 * Prompt identity of a business vertical (tone, audience, brand rules, seeds).
 * Rows live in social_vertical_profiles; {@code general} is the fallback profile.
 */
public record VerticalProfile(
        String verticalKey,
        String promptSystem,
        String promptUserPrefix,
        String tone,
        String audience,
        String brandRules,
        List<String> imageStyleRules,
        List<String> hashtagSeed,
        List<String> ctaLibrary,
        Instant version) {

    public static final String GENERAL = "general";

    static final String DEFAULT_SYSTEM_PROMPT = "Responde SOLO JSON válido con el schema solicitado.";

    public VerticalProfile {
        imageStyleRules = imageStyleRules == null ? List.of() : List.copyOf(imageStyleRules);
        hashtagSeed = hashtagSeed == null ? List.of() : List.copyOf(hashtagSeed);
        ctaLibrary = ctaLibrary == null ? List.of() : List.copyOf(ctaLibrary);
    }

    /** Profile used when neither the requested vertical nor {@code general} is configured. */
    public static VerticalProfile builtInDefault(String verticalKey) {
        return new VerticalProfile(verticalKey, DEFAULT_SYSTEM_PROMPT, "", null, null, null,
                List.of(), List.of(), List.of(), null);
    }

    public String systemPromptOrDefault() {
        return promptSystem == null || promptSystem.isBlank() ? DEFAULT_SYSTEM_PROMPT : promptSystem;
    }
}
