package win.ixuni.s3probe.gateway.memory.handler.object;

import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectSummary;
import win.ixuni.s3probe.gateway.memory.context.MemoryGatewayContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Key listing shared by ListObjects and ListObjectsV2: latest live versions in key order, with
 * delimiter grouping and a page limit.
 */
final class ObjectListing {

    static final int DEFAULT_MAX_KEYS = 1000;

    private ObjectListing() {
    }

    /**
     * @param startAfter exclusive lower bound on keys, null for the first page
     */
    static ListObjectsResult list(MemoryGatewayContext.BucketState bucket, String prefix, String delimiter,
                                  String startAfter, Integer maxKeys) {
        String effectivePrefix = prefix != null ? prefix : "";
        int limit = maxKeys != null && maxKeys >= 0 ? maxKeys : DEFAULT_MAX_KEYS;

        List<ObjectSummary> objects = new ArrayList<>();
        TreeSet<String> commonPrefixes = new TreeSet<>();
        String lastKey = null;
        boolean truncated = false;

        Map<String, List<MemoryGatewayContext.ObjectData>> tail = startAfter != null
                ? bucket.getObjects().tailMap(startAfter, false)
                : bucket.getObjects();
        for (String key : tail.keySet()) {
            if (!key.startsWith(effectivePrefix)) {
                continue;
            }
            MemoryGatewayContext.ObjectData latest = bucket.latest(key);
            if (latest == null) {
                continue;
            }
            if (objects.size() + commonPrefixes.size() >= limit) {
                truncated = true;
                break;
            }
            if (delimiter != null && !delimiter.isEmpty()) {
                String rest = key.substring(effectivePrefix.length());
                int index = rest.indexOf(delimiter);
                if (index >= 0) {
                    commonPrefixes.add(effectivePrefix + rest.substring(0, index + delimiter.length()));
                    lastKey = key;
                    continue;
                }
            }
            objects.add(ObjectSummary.builder()
                    .key(key)
                    .size((long) latest.getData().length)
                    .etag(latest.getEtag())
                    .lastModified(latest.getLastModified())
                    .storageClass("STANDARD")
                    .build());
            lastKey = key;
        }

        return ListObjectsResult.builder()
                .bucketName(bucket.getName())
                .prefix(prefix)
                .objects(objects)
                .commonPrefixes(List.copyOf(commonPrefixes))
                .truncated(truncated)
                .nextToken(truncated ? lastKey : null)
                .keyCount(objects.size() + commonPrefixes.size())
                .build();
    }
}
