package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.ResponseMetadata;
import ai.customfit.sdk.subsystems.Transport;
import ai.customfit.sdk.subsystems.TransportResponse;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import okhttp3.ConnectionPool;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * The OkHttp-based {@link Transport}. Calls are synchronous; the SDK's task executor decides
 * which thread they block.
 */
final class HttpTransport implements Transport, Closeable {
    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String USER_AGENT = CFPackageConsts.SDK_CLIENT_NAME + "/" + CFPackageConsts.SDK_VERSION;

    private final OkHttpClient client;
    private final LDLogger logger;

    HttpTransport(CFConfig config, LDLogger logger) {
        this.logger = logger;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(config.getNetworkConnectionTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(config.getNetworkReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(config.getNetworkReadTimeoutMs(), TimeUnit.MILLISECONDS)
                // idle connections are not kept alive between the SDK's infrequent requests
                .connectionPool(new ConnectionPool(0, 1, TimeUnit.MILLISECONDS))
                // retries are the SDK's job
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public TransportResponse post(String url, String jsonBody) throws CFFailure {
        Request request = baseRequest(url)
                .post(RequestBody.create(jsonBody, JSON))
                .build();
        return execute(request);
    }

    @Override
    public ResponseMetadata fetchMetadata(String url) throws CFFailure {
        Request request = baseRequest(url).head().build();
        return execute(request).getMetadata();
    }

    @Override
    public TransportResponse fetchFull(String url, String jsonBody, String etag, String lastModified)
            throws CFFailure {
        Request.Builder builder = baseRequest(url);
        if (etag != null) {
            builder.header("If-None-Match", etag);
        }
        if (lastModified != null) {
            builder.header("If-Modified-Since", lastModified);
        }
        if (jsonBody != null) {
            builder.post(RequestBody.create(jsonBody, JSON));
        }
        return execute(builder.build());
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Request.Builder baseRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
    }

    private TransportResponse execute(Request request) throws CFFailure {
        logger.debug("{} {}", request.method(), request.url());
        try (Response response = client.newCall(request).execute()) {
            int code = response.code();
            ResponseMetadata metadata = metadataOf(response.headers());
            if (code == TransportResponse.NOT_MODIFIED) {
                return new TransportResponse(code, metadata, null);
            }
            ResponseBody responseBody = response.body();
            String body = responseBody == null ? null : responseBody.string();
            if (!response.isSuccessful()) {
                throw new CFInvalidResponseCodeFailure("Unexpected response " + code + " from " + request.url(),
                        code, CFUtil.isHttpErrorRecoverable(code));
            }
            return new TransportResponse(code, metadata, body);
        } catch (IOException e) {
            throw new CFFailure("Network error calling " + request.url(), e, CFFailure.FailureType.NETWORK_FAILURE);
        }
    }

    private static ResponseMetadata metadataOf(Headers headers) {
        return new ResponseMetadata(headers.get("ETag"), headers.get("Last-Modified"));
    }
}
