package ai.customfit.sdk.subsystems;

import java.io.IOException;
import java.util.Collection;

/**
 * Storage for values that are too large to keep in the {@link PersistentDataStore}.
 * <p>
 * Blob names are generated by the SDK and contain only alphanumeric characters, hyphens, and
 * underscores. Implementations should throw {@link IOException} on any failure; the SDK treats a
 * failed read as a cache miss and discards the record that pointed at the blob.
 */
public interface BlobStore {
    /**
     * Reads a blob.
     *
     * @param name the blob name
     * @return the blob contents, or null if there is no such blob
     * @throws IOException if the blob exists but cannot be read
     */
    byte[] read(String name) throws IOException;

    /**
     * Creates or replaces a blob.
     *
     * @param name the blob name
     * @param data the contents
     * @throws IOException if the blob cannot be written
     */
    void write(String name, byte[] data) throws IOException;

    /**
     * Deletes a blob. Deleting a nonexistent blob is not an error.
     *
     * @param name the blob name
     * @return true if a blob was deleted
     * @throws IOException if the blob exists but cannot be deleted
     */
    boolean delete(String name) throws IOException;

    /**
     * @return the names of all stored blobs
     * @throws IOException if the store cannot be listed
     */
    Collection<String> list() throws IOException;
}
