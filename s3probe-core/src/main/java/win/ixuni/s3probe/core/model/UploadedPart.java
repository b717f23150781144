package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A part of a multipart upload: returned by UploadPart and ListParts, sent with CompleteMultipartUpload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadedPart {

    private int partNumber;

    private String etag;

    private Long size;

    private Instant lastModified;
}
