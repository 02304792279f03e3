package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.BlobStore;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Default {@link BlobStore}: one file per blob in a directory.
 */
final class FileBlobStore implements BlobStore {
    private static final String FILE_SUFFIX = ".blob";

    private final Path directory;

    FileBlobStore(File directory) {
        this.directory = directory.toPath();
    }

    @Override
    public byte[] read(String name) throws IOException {
        try {
            return Files.readAllBytes(fileFor(name));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public void write(String name, byte[] data) throws IOException {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, name, ".tmp");
        Files.write(temp, data);
        Files.move(temp, fileFor(name), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public boolean delete(String name) throws IOException {
        return Files.deleteIfExists(fileFor(name));
    }

    @Override
    public Collection<String> list() throws IOException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path p: stream) {
                String fileName = p.getFileName().toString();
                names.add(fileName.substring(0, fileName.length() - FILE_SUFFIX.length()));
            }
        }
        return names;
    }

    private Path fileFor(String name) {
        return directory.resolve(name + FILE_SUFFIX);
    }
}
