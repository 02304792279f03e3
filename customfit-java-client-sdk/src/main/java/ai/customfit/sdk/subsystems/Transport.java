package ai.customfit.sdk.subsystems;

import ai.customfit.sdk.CFFailure;

/**
 * The HTTP collaborator used for every network call the SDK makes.
 * <p>
 * The SDK provides an OkHttp-based implementation. Implementations must be safe to call from
 * several threads at once, must not retry on their own (the SDK applies its own retry policy),
 * and must report failures as follows:
 * <ul>
 *     <li> I/O errors, including interruption: {@link CFFailure} with type
 *     {@link CFFailure.FailureType#NETWORK_FAILURE}. </li>
 *     <li> A status other than 2xx or 304: {@link ai.customfit.sdk.CFInvalidResponseCodeFailure}. </li>
 * </ul>
 */
public interface Transport {
    /**
     * Sends a JSON document.
     *
     * @param url the destination
     * @param jsonBody the request body
     * @return the response
     * @throws CFFailure if the request failed
     */
    TransportResponse post(String url, String jsonBody) throws CFFailure;

    /**
     * Makes a lightweight request that returns only the validators of a document.
     *
     * @param url the document URL
     * @return the document's validators; fields are null if the server did not send them
     * @throws CFFailure if the request failed
     */
    ResponseMetadata fetchMetadata(String url) throws CFFailure;

    /**
     * Fetches a document, conditionally if validators are supplied. If {@code jsonBody} is
     * non-null the request is a POST carrying that body; otherwise it is a GET.
     *
     * @param url the document URL
     * @param jsonBody a request body, or null
     * @param etag sent as {@code If-None-Match} if non-null
     * @param lastModified sent as {@code If-Modified-Since} if non-null
     * @return the response; {@link TransportResponse#isNotModified()} is true if unchanged
     * @throws CFFailure if the request failed
     */
    TransportResponse fetchFull(String url, String jsonBody, String etag, String lastModified) throws CFFailure;

    /**
     * Fetches a document with a GET, conditionally if validators are supplied.
     *
     * @param url the document URL
     * @param etag sent as {@code If-None-Match} if non-null
     * @param lastModified sent as {@code If-Modified-Since} if non-null
     * @return the response
     * @throws CFFailure if the request failed
     */
    default TransportResponse fetchFull(String url, String etag, String lastModified) throws CFFailure {
        return fetchFull(url, null, etag, lastModified);
    }
}
