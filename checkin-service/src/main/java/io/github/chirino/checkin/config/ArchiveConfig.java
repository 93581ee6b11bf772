package io.github.chirino.checkin.config;

import io.github.chirino.checkin.archive.ArchiveLimits;
import io.quarkus.runtime.configuration.MemorySize;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ArchiveConfig {

    @ConfigProperty(name = "checkin.archive.max-entries", defaultValue = "10000")
    int maxEntries;

    @ConfigProperty(name = "checkin.archive.max-declared-size", defaultValue = "500M")
    MemorySize maxDeclaredSize;

    @ConfigProperty(name = "checkin.archive.max-upload-size", defaultValue = "200M")
    MemorySize maxUploadSize;

    @ConfigProperty(name = "checkin.archive.max-entry-size", defaultValue = "50M")
    MemorySize maxEntrySize;

    @ConfigProperty(name = "checkin.archive.preview-count", defaultValue = "3")
    int previewCount;

    @ConfigProperty(name = "checkin.archive.thumbnail-size", defaultValue = "200")
    int thumbnailSize;

    @ConfigProperty(name = "checkin.archive.full-image-size", defaultValue = "800")
    int fullImageSize;

    @ConfigProperty(name = "checkin.archive.max-thumbnails", defaultValue = "50")
    int maxThumbnails;

    @ConfigProperty(name = "checkin.archive.processing-timeout", defaultValue = "PT20S")
    Duration processingTimeout;

    @ConfigProperty(name = "checkin.archive.max-workers", defaultValue = "4")
    int maxWorkers;

    @ConfigProperty(name = "checkin.archive.queue-capacity", defaultValue = "16")
    int queueCapacity;

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxDeclaredSize() {
        return maxDeclaredSize.asLongValue();
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public ArchiveLimits getLimits() {
        return new ArchiveLimits(
                maxUploadSize.asLongValue(),
                maxEntrySize.asLongValue(),
                previewCount,
                thumbnailSize,
                fullImageSize,
                maxThumbnails,
                processingTimeout);
    }
}
