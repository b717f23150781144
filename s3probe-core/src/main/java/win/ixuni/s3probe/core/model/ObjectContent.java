package win.ixuni.s3probe.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body and headers of a GetObject response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectContent {

    /**
     * HTTP status of the response: 200 for a full body, 206 for a partial one
     */
    private int statusCode;

    /**
     * Content-Range header, null for full responses
     */
    private String contentRange;

    private ObjectMetadata metadata;

    private byte[] data;

    public int length() {
        return data != null ? data.length : 0;
    }
}
