package ai.customfit.sdk.subsystems;

/**
 * A successful (2xx or 304) response from a {@link Transport}.
 */
public final class TransportResponse {
    /**
     * HTTP status for a conditional request whose document has not changed.
     */
    public static final int NOT_MODIFIED = 304;

    private final int statusCode;
    private final ResponseMetadata metadata;
    private final String body;

    /**
     * @param statusCode the HTTP status
     * @param metadata the response validators; never null
     * @param body the response body, or null if there was none
     */
    public TransportResponse(int statusCode, ResponseMetadata metadata, String body) {
        this.statusCode = statusCode;
        this.metadata = metadata == null ? new ResponseMetadata(null, null) : metadata;
        this.body = body;
    }

    /**
     * @return the HTTP status
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the response validators
     */
    public ResponseMetadata getMetadata() {
        return metadata;
    }

    /**
     * @return the response body, or null
     */
    public String getBody() {
        return body;
    }

    /**
     * @return true if the server answered a conditional request with "not modified"
     */
    public boolean isNotModified() {
        return statusCode == NOT_MODIFIED;
    }
}
