package io.github.chirino.checkin.api;

import io.github.chirino.checkin.service.Attachment;
import io.github.chirino.checkin.storage.StorageException;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.multipart.FileItem;
import org.jboss.resteasy.reactive.server.multipart.FormValue;
import org.jboss.resteasy.reactive.server.multipart.MultipartFormDataInput;

/**
 * Reads text fields and file parts of a multipart request. Parts the server kept in memory are
 * spooled to temporary files, which {@link #close()} removes.
 */
final class MultipartUploads implements Closeable {

    private static final Logger LOG = Logger.getLogger(MultipartUploads.class);

    private final MultipartFormDataInput input;
    private final List<Path> spooled = new ArrayList<>();

    MultipartUploads(MultipartFormDataInput input) {
        this.input = input;
    }

    String text(String name) {
        Collection<FormValue> values = input.getValues().get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        FormValue value = values.iterator().next();
        return value.isFileItem() ? null : value.getValue();
    }

    List<Attachment> files(String name) {
        Collection<FormValue> values = input.getValues().get(name);
        List<Attachment> attachments = new ArrayList<>();
        if (values == null) {
            return attachments;
        }
        for (FormValue value : values) {
            if (value.isFileItem()) {
                attachments.add(toAttachment(value));
            }
        }
        return attachments;
    }

    Attachment file(String name) {
        List<Attachment> attachments = files(name);
        return attachments.isEmpty() ? null : attachments.get(0);
    }

    private Attachment toAttachment(FormValue value) {
        FileItem item = value.getFileItem();
        try {
            Path file = item.isInMemory() ? null : item.getFile();
            if (file == null) {
                file = Files.createTempFile("checkin-upload-", ".part");
                spooled.add(file);
                try (InputStream in = item.getInputStream()) {
                    Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            return new Attachment(value.getFileName(), file, Files.size(file));
        } catch (IOException e) {
            throw StorageException.storageError("Failed to read uploaded file", e);
        }
    }

    @Override
    public void close() {
        for (Path file : spooled) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warnf("Failed to remove spooled upload %s: %s", file, e.getMessage());
            }
        }
        spooled.clear();
    }
}
