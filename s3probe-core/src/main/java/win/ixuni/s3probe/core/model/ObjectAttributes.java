package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * GetObjectAttributes result. Every field is optional: the backend only returns what was requested
 * and what it supports.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectAttributes {

    private String etag;

    private Long objectSize;

    private String storageClass;

    private Integer totalPartsCount;

    private List<UploadedPart> parts;
}
