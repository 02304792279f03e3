package ai.customfit.sdk.subsystems;

import java.util.Objects;

/**
 * The validators a server returned for a document: its entity tag and last-modified timestamp.
 * Either or both may be null.
 */
public final class ResponseMetadata {
    private final String etag;
    private final String lastModified;

    /**
     * @param etag the {@code ETag} header value, or null
     * @param lastModified the {@code Last-Modified} header value, or null
     */
    public ResponseMetadata(String etag, String lastModified) {
        this.etag = etag;
        this.lastModified = lastModified;
    }

    /**
     * @return the {@code ETag} header value, or null
     */
    public String getEtag() {
        return etag;
    }

    /**
     * @return the {@code Last-Modified} header value, or null
     */
    public String getLastModified() {
        return lastModified;
    }

    /**
     * @return true if neither validator is present
     */
    public boolean isEmpty() {
        return etag == null && lastModified == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResponseMetadata)) {
            return false;
        }
        ResponseMetadata other = (ResponseMetadata) o;
        return Objects.equals(etag, other.etag) && Objects.equals(lastModified, other.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(etag, lastModified);
    }

    @Override
    public String toString() {
        return "ResponseMetadata(etag=" + etag + ", lastModified=" + lastModified + ")";
    }
}
