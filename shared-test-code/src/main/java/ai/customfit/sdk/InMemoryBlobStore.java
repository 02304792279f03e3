package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.BlobStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlobStore implements BlobStore {
    private final ConcurrentHashMap<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public byte[] read(String name) {
        byte[] data = blobs.get(name);
        return data == null ? null : data.clone();
    }

    @Override
    public void write(String name, byte[] data) {
        blobs.put(name, data.clone());
    }

    @Override
    public boolean delete(String name) {
        return blobs.remove(name) != null;
    }

    @Override
    public Collection<String> list() {
        return new ArrayList<>(blobs.keySet());
    }
}
