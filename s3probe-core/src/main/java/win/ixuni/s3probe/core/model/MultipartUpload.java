package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * In-progress multipart upload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultipartUpload {

    private String bucketName;

    private String key;

    private String uploadId;

    private Instant initiated;
}
