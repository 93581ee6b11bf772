package io.github.chirino.checkin.archive;

/** Either a {@link ValidatedArchive} or the reason it was rejected. */
public record ArchiveValidation(ValidatedArchive archive, ArchiveRejectedException rejection) {

    static ArchiveValidation ok(ValidatedArchive archive) {
        return new ArchiveValidation(archive, null);
    }

    static ArchiveValidation reject(ArchiveRejectedException rejection) {
        return new ArchiveValidation(null, rejection);
    }

    static ArchiveValidation reject(String reason, String message) {
        return reject(new ArchiveRejectedException(reason, message));
    }

    public boolean isOk() {
        return archive != null;
    }

    public String reason() {
        return rejection == null ? null : rejection.getReason();
    }

    public ValidatedArchive orElseThrow() {
        if (rejection != null) {
            throw rejection;
        }
        return archive;
    }
}
