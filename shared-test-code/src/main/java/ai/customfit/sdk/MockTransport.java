package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.ResponseMetadata;
import ai.customfit.sdk.subsystems.Transport;
import ai.customfit.sdk.subsystems.TransportResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link Transport} that records every request and answers from handlers set by the test.
 * By default it serves an enabled settings document and an empty config document, with no
 * validators, and accepts every POST.
 */
public class MockTransport implements Transport {
    public static final String METHOD_POST = "POST";
    public static final String METHOD_METADATA = "HEAD";
    public static final String METHOD_FULL = "FETCH";

    public static final class Request {
        public final String method;
        public final String url;
        public final String body;
        public final String etag;
        public final String lastModified;

        Request(String method, String url, String body, String etag, String lastModified) {
            this.method = method;
            this.url = url;
            this.body = body;
            this.etag = etag;
            this.lastModified = lastModified;
        }

        public boolean isSettingsRequest() {
            return url.endsWith("cf-sdk-settings.json");
        }
    }

    @FunctionalInterface
    public interface Handler<R> {
        R handle(Request request) throws CFFailure;
    }

    private final CopyOnWriteArrayList<Request> requests = new CopyOnWriteArrayList<>();

    public volatile Handler<TransportResponse> postHandler = r -> new TransportResponse(202, null, "");
    public volatile Handler<ResponseMetadata> metadataHandler = r -> new ResponseMetadata(null, null);
    public volatile Handler<TransportResponse> fullHandler = r -> new TransportResponse(200, null,
            r.isSettingsRequest() ? "{\"cf_account_enabled\":true,\"cf_skip_sdk\":false}" : "{\"configs\":{}}");

    /**
     * Serves a settings document with the given validators, and a config document.
     */
    public void serve(String etag, String lastModified, String settingsJson, String configJson) {
        ResponseMetadata metadata = new ResponseMetadata(etag, lastModified);
        metadataHandler = r -> metadata;
        fullHandler = r -> r.isSettingsRequest()
                ? new TransportResponse(200, metadata, settingsJson)
                : new TransportResponse(200, metadata, configJson);
    }

    @Override
    public TransportResponse post(String url, String jsonBody) throws CFFailure {
        Request request = new Request(METHOD_POST, url, jsonBody, null, null);
        requests.add(request);
        return postHandler.handle(request);
    }

    @Override
    public ResponseMetadata fetchMetadata(String url) throws CFFailure {
        Request request = new Request(METHOD_METADATA, url, null, null, null);
        requests.add(request);
        return metadataHandler.handle(request);
    }

    @Override
    public TransportResponse fetchFull(String url, String jsonBody, String etag, String lastModified)
            throws CFFailure {
        Request request = new Request(METHOD_FULL, url, jsonBody, etag, lastModified);
        requests.add(request);
        return fullHandler.handle(request);
    }

    public List<Request> getRequests() {
        return new ArrayList<>(requests);
    }

    public List<Request> getRequests(String method) {
        List<Request> ret = new ArrayList<>();
        for (Request r: requests) {
            if (r.method.equals(method)) {
                ret.add(r);
            }
        }
        return ret;
    }

    public int countConfigFetches() {
        int n = 0;
        for (Request r: requests) {
            if (r.method.equals(METHOD_FULL) && !r.isSettingsRequest()) {
                n++;
            }
        }
        return n;
    }

    public int countSettingsFetches() {
        int n = 0;
        for (Request r: requests) {
            if (r.method.equals(METHOD_FULL) && r.isSettingsRequest()) {
                n++;
            }
        }
        return n;
    }

    public void clearRequests() {
        requests.clear();
    }
}
