package win.ixuni.s3probe.checks;

import win.ixuni.s3probe.checks.category.*;
import win.ixuni.s3probe.core.check.CategoryDefinition;

import java.util.List;

/**
 * Every check category, in the order a full run executes them
 */
public final class CheckCatalog {

    private static final List<CategoryDefinition> CATEGORIES = List.of(
            new CategoryDefinition(BucketChecks.NAME,
                    "Bucket creation, naming rules, listing, HEAD, versioning, tagging and deletion",
                    BucketChecks::new),
            new CategoryDefinition(ObjectChecks.NAME,
                    "Object upload, download, HEAD, copy, listing, tagging and deletion",
                    ObjectChecks::new),
            new CategoryDefinition(MultipartChecks.NAME,
                    "Multipart upload creation, parts, completion, abort and listing",
                    MultipartChecks::new),
            new CategoryDefinition(VersioningChecks.NAME,
                    "Bucket versioning and version-specific object operations",
                    VersioningChecks::new),
            new CategoryDefinition(TaggingChecks.NAME,
                    "Bucket and object tag sets",
                    TaggingChecks::new),
            new CategoryDefinition(AttributesChecks.NAME,
                    "GetObjectAttributes: ETag, size, storage class and parts",
                    AttributesChecks::new),
            new CategoryDefinition(MetadataChecks.NAME,
                    "Standard headers, custom metadata, encoding, limits and copy behavior",
                    MetadataChecks::new),
            new CategoryDefinition(RangeRequestChecks.NAME,
                    "Partial retrieval with Range and If-Range headers",
                    RangeRequestChecks::new),
            new CategoryDefinition(ErrorConditionChecks.NAME,
                    "Error codes for invalid, malformed and conflicting requests",
                    ErrorConditionChecks::new),
            new CategoryDefinition(SyncChecks.NAME,
                    "Batch transfers, directory trees and paginated listings",
                    SyncChecks::new));

    private CheckCatalog() {
    }

    public static List<CategoryDefinition> categories() {
        return CATEGORIES;
    }
}
