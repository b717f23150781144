package win.ixuni.s3probe.gateway.s3.handler;

import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between tag maps and the SDK's tag sets
 */
public final class Tags {

    private Tags() {
    }

    public static Map<String, String> toMap(List<Tag> tagSet) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : tagSet) {
            tags.put(tag.key(), tag.value());
        }
        return tags;
    }

    public static Tagging toTagging(Map<String, String> tags) {
        List<Tag> tagSet = tags == null ? List.of() : tags.entrySet().stream()
                .map(entry -> Tag.builder().key(entry.getKey()).value(entry.getValue()).build())
                .toList();
        return Tagging.builder().tagSet(tagSet).build();
    }
}
