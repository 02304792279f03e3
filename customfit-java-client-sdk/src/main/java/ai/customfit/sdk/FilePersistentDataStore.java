package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.PersistentDataStore;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Default {@link PersistentDataStore}: each namespace is a {@code .properties} file in a
 * directory. Files are rewritten through a temporary file and an atomic move, so a crash during a
 * write leaves the previous contents in place.
 * <p>
 * Loaded namespaces are kept in memory; this class assumes it is the only writer of its directory.
 */
final class FilePersistentDataStore implements PersistentDataStore {
    private static final String FILE_SUFFIX = ".properties";

    private final Path directory;
    private final Map<String, Properties> loaded = new HashMap<>();

    FilePersistentDataStore(File directory) {
        this.directory = directory.toPath();
    }

    @Override
    public synchronized String getValue(String storeNamespace, String key) {
        return load(storeNamespace).getProperty(key);
    }

    @Override
    public synchronized void setValue(String storeNamespace, String key, String value) {
        Properties props = load(storeNamespace);
        if (value == null) {
            props.remove(key);
        } else {
            props.setProperty(key, value);
        }
        save(storeNamespace, props);
    }

    @Override
    public synchronized void setValues(String storeNamespace, Map<String, String> keysAndValues) {
        Properties props = load(storeNamespace);
        for (Map.Entry<String, String> kv: keysAndValues.entrySet()) {
            if (kv.getValue() == null) {
                props.remove(kv.getKey());
            } else {
                props.setProperty(kv.getKey(), kv.getValue());
            }
        }
        save(storeNamespace, props);
    }

    @Override
    public synchronized Collection<String> getKeys(String storeNamespace) {
        return new ArrayList<>(load(storeNamespace).stringPropertyNames());
    }

    @Override
    public synchronized void clear(String storeNamespace) {
        loaded.put(storeNamespace, new Properties());
        try {
            Files.deleteIfExists(fileFor(storeNamespace));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Properties load(String storeNamespace) {
        Properties props = loaded.get(storeNamespace);
        if (props != null) {
            return props;
        }
        props = new Properties();
        Path file = fileFor(storeNamespace);
        if (Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        loaded.put(storeNamespace, props);
        return props;
    }

    private void save(String storeNamespace, Properties props) {
        try {
            Files.createDirectories(directory);
            Path target = fileFor(storeNamespace);
            Path temp = Files.createTempFile(directory, storeNamespace, ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                props.store(out, null);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path fileFor(String storeNamespace) {
        return directory.resolve(storeNamespace + FILE_SUFFIX);
    }
}
