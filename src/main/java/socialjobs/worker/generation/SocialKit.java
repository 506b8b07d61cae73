package socialjobs.worker.generation;

import java.util.List;

/**
 * Ready-to-publish social post pack.
 */
public record SocialKit(
        String title,
        String hook,
        String caption,
        String cta,
        List<String> hashtags,
        List<String> imagePrompts) {

    public SocialKit {
        hashtags = List.copyOf(hashtags);
        imagePrompts = List.copyOf(imagePrompts);
    }
}
