package io.github.chirino.checkin.persistence.repo;

import io.github.chirino.checkin.persistence.entity.LikeEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.OffsetDateTime;

@ApplicationScoped
public class LikeRepository implements PanacheRepositoryBase<LikeEntity, Long> {

    /**
     * Inserts a like unless the (submission, ip) pair already exists.
     *
     * @return {@code true} when a row was inserted
     */
    public boolean insertIfAbsent(long submissionId, String ipAddress) {
        int inserted =
                getEntityManager()
                        .createNativeQuery(
                                "INSERT INTO submission_likes (submission_id, ip_address,"
                                        + " created_at) VALUES (:submissionId, :ip, :createdAt)"
                                        + " ON CONFLICT (submission_id, ip_address) DO NOTHING")
                        .setParameter("submissionId", submissionId)
                        .setParameter("ip", ipAddress)
                        .setParameter("createdAt", OffsetDateTime.now())
                        .executeUpdate();
        return inserted > 0;
    }
}
