package socialjobs.worker.generation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema of the social kit: title, hook, caption, cta, hashtags and image prompts.
 * Hashtags are normalized to start with '#'; image prompts may come as strings or {"prompt": "..."} objects.
 */
public final class SocialKitSchema implements OutputSchema<SocialKit> {

    public static final SocialKitSchema INSTANCE = new SocialKitSchema();

    private SocialKitSchema() {
    }

    @Override
    public String describe() {
        return """
                {
                  "title": string,
                  "hook": string,
                  "caption": string,
                  "hashtags": string[],
                  "cta": string,
                  "image_prompts": string[]
                }""";
    }

    @Override
    public SocialKit conform(JsonNode node) throws MalformedOutputException {
        if (node == null || !node.isObject()) {
            throw new MalformedOutputException("Generated content is not a JSON object");
        }

        String title = requiredText(node, "title");
        String hook = requiredText(node, "hook");
        String caption = requiredText(node, "caption");
        String cta = requiredText(node, "cta");

        List<String> hashtags = new ArrayList<>();
        for (String tag : textItems(node.get("hashtags"), null)) {
            hashtags.add(tag.startsWith("#") ? tag : "#" + tag);
        }
        if (hashtags.isEmpty()) {
            throw new MalformedOutputException("Missing/empty 'hashtags' in generated content");
        }

        List<String> imagePrompts = textItems(node.get("image_prompts"), "prompt");
        if (imagePrompts.isEmpty()) {
            throw new MalformedOutputException("Missing/empty 'image_prompts' in generated content");
        }

        return new SocialKit(title, hook, caption, cta, hashtags, imagePrompts);
    }

    private static String requiredText(JsonNode node, String field) throws MalformedOutputException {
        JsonNode value = node.get(field);
        String text = value == null || value.isNull() || value.isContainerNode() ? "" : value.asText().trim();
        if (text.isEmpty()) {
            throw new MalformedOutputException("Missing '" + field + "' in generated content");
        }
        return text;
    }

    private static List<String> textItems(JsonNode array, String objectField) {
        List<String> items = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return items;
        }
        for (JsonNode item : array) {
            JsonNode value = item.isObject() && objectField != null ? item.get(objectField) : item;
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String text = value.asText().trim();
            if (!text.isEmpty()) {
                items.add(text);
            }
        }
        return items;
    }
}
