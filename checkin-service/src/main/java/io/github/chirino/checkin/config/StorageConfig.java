package io.github.chirino.checkin.config;

import io.quarkus.runtime.configuration.MemorySize;
import jakarta.enterprise.context.ApplicationScoped;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class StorageConfig {

    @ConfigProperty(name = "checkin.storage.upload-dir", defaultValue = "uploads")
    String uploadDir;

    @ConfigProperty(name = "checkin.media.max-size", defaultValue = "20M")
    MemorySize mediaMaxSize;

    public Path getUploadDir() {
        return Path.of(uploadDir);
    }

    public long getMediaMaxSize() {
        return mediaMaxSize.asLongValue();
    }
}
