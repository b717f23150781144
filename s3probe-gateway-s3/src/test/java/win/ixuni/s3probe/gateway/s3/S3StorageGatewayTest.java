package win.ixuni.s3probe.gateway.s3;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.*;
import win.ixuni.s3probe.core.config.ProbeProperties;
import win.ixuni.s3probe.core.exception.InitializationException;
import win.ixuni.s3probe.core.gateway.GatewayResult;
import win.ixuni.s3probe.core.model.ListObjectsResult;
import win.ixuni.s3probe.core.model.ObjectMetadata;
import win.ixuni.s3probe.core.model.StoredObject;
import win.ixuni.s3probe.core.operation.bucket.CreateBucketOperation;
import win.ixuni.s3probe.core.operation.object.HeadObjectOperation;
import win.ixuni.s3probe.core.operation.object.ListObjectsOperation;
import win.ixuni.s3probe.core.operation.object.PutObjectOperation;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3StorageGatewayTest {

    private S3AsyncClient client;
    private S3StorageGateway gateway;

    @BeforeEach
    void setUp() {
        client = mock(S3AsyncClient.class);
        ProbeProperties.TimeoutConfig timeouts = new ProbeProperties.TimeoutConfig();
        timeouts.setOperation(Duration.ofSeconds(2));
        gateway = new S3StorageGateway(client, "eu-west-1", timeouts);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    @DisplayName("Put object maps request fields and the returned ETag")
    void putObjectPassesMetadata() {
        when(client.putObject(any(PutObjectRequest.class), any(AsyncRequestBody.class)))
                .thenReturn(CompletableFuture.completedFuture(PutObjectResponse.builder()
                        .eTag("\"abc\"")
                        .build()));

        GatewayResult<StoredObject> result = gateway.putObject(PutObjectOperation.builder()
                .bucketName("bucket")
                .key("key")
                .content("hello".getBytes(StandardCharsets.UTF_8))
                .contentType("text/plain")
                .metadata(Map.of("k", "v"))
                .build());

        assertTrue(result.isSuccess());
        assertEquals("\"abc\"", result.getValue().getEtag());
        assertEquals(5L, result.getValue().getSize());
        verify(client).putObject(argThat((PutObjectRequest request) ->
                        "text/plain".equals(request.contentType())
                                && "v".equals(request.metadata().get("k"))
                                && request.contentLength() == 5L),
                any(AsyncRequestBody.class));
    }

    @Test
    @DisplayName("Failed future becomes a GatewayError with the S3 code")
    void failedFutureBecomesGatewayError() {
        S3Exception notFound = (S3Exception) NoSuchKeyException.builder()
                .statusCode(404)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchKey").build())
                .build();
        when(client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(notFound));

        GatewayResult<ObjectMetadata> result = gateway.headObject(new HeadObjectOperation("bucket", "missing"));

        assertTrue(result.isFailure());
        assertEquals("NoSuchKey", result.getError().getCode());
        assertEquals(404, result.getError().getHttpStatus());
    }

    @Test
    @DisplayName("A future that never completes fails with RequestTimeout")
    void hangingCallTimesOut() {
        when(client.headObject(any(HeadObjectRequest.class))).thenReturn(new CompletableFuture<>());

        GatewayResult<ObjectMetadata> result = gateway.headObject(new HeadObjectOperation("bucket", "slow"));

        assertTrue(result.isFailure());
        assertEquals("RequestTimeout", result.getError().getCode());
        assertEquals(0, result.getError().getHttpStatus());
    }

    @Test
    @DisplayName("Create bucket outside us-east-1 sends a location constraint")
    void createBucketSendsLocationConstraint() {
        when(client.createBucket(any(CreateBucketRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(CreateBucketResponse.builder().build()));

        assertTrue(gateway.createBucket(new CreateBucketOperation("bucket")).isSuccess());

        verify(client).createBucket(argThat((CreateBucketRequest request) ->
                request.createBucketConfiguration() != null
                        && "eu-west-1".equals(request.createBucketConfiguration().locationConstraintAsString())));
    }

    @Test
    @DisplayName("V1 listing without NextMarker continues from the last key")
    void listObjectsUsesLastKeyAsMarker() {
        when(client.listObjects(any(ListObjectsRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(ListObjectsResponse.builder()
                        .isTruncated(true)
                        .contents(S3Object.builder().key("a").size(1L).build(),
                                S3Object.builder().key("b").size(1L).build())
                        .build()));

        GatewayResult<ListObjectsResult> result = gateway.listObjects(ListObjectsOperation.builder()
                .bucketName("bucket")
                .maxKeys(2)
                .build());

        assertTrue(result.isSuccess());
        assertTrue(result.getValue().isTruncated());
        assertEquals("b", result.getValue().getNextToken());
    }

    @Test
    @DisplayName("Missing credentials are an initialization failure")
    void missingCredentialsFailFast() {
        ProbeProperties properties = new ProbeProperties();
        properties.getConnection().setAccessKey("");

        assertThrows(InitializationException.class, () -> new S3StorageGateway(properties));
    }
}
