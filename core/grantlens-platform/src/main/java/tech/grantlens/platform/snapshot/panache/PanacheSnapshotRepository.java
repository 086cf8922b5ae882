package tech.grantlens.platform.snapshot.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.RawEntitiesCodec;
import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.SnapshotRepository;
import tech.grantlens.platform.snapshot.SnapshotStatus;
import tech.grantlens.platform.snapshot.entity.SnapshotEntity;
import tech.grantlens.platform.snapshot.mapper.SnapshotMapper;

import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of SnapshotRepository.
 * Reads use the EntityManager directly to return domain objects; writes go through
 * {@link SnapshotWriteRepository}. The raw JSON column is only read by
 * {@link #findRawEntities(String)}.
 */
@ApplicationScoped
public class PanacheSnapshotRepository implements SnapshotRepository {

    @Inject
    EntityManager em;

    @Inject
    SnapshotWriteRepository writeRepo;

    @Inject
    RawEntitiesCodec codec;

    @Override
    public Optional<Snapshot> findByIdOptional(String id) {
        return Optional.ofNullable(SnapshotMapper.toDomain(em.find(SnapshotEntity.class, id)));
    }

    @Override
    public List<Snapshot> findByClusterId(String clusterId, int limit) {
        return em.createQuery(
                "FROM SnapshotEntity WHERE clusterId = :clusterId ORDER BY createdAt DESC, id DESC",
                SnapshotEntity.class)
            .setParameter("clusterId", clusterId)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(SnapshotMapper::toDomain)
            .toList();
    }

    @Override
    public Optional<Snapshot> findLatestCompleted(String clusterId) {
        return em.createQuery(
                "FROM SnapshotEntity WHERE clusterId = :clusterId AND status = :status ORDER BY createdAt DESC, id DESC",
                SnapshotEntity.class)
            .setParameter("clusterId", clusterId)
            .setParameter("status", SnapshotStatus.COMPLETED)
            .setMaxResults(1)
            .getResultList()
            .stream()
            .findFirst()
            .map(SnapshotMapper::toDomain);
    }

    @Override
    public boolean existsForCluster(String clusterId) {
        return em.createQuery("SELECT COUNT(e) FROM SnapshotEntity e WHERE e.clusterId = :clusterId", Long.class)
            .setParameter("clusterId", clusterId)
            .getSingleResult() > 0;
    }

    @Override
    public Optional<RawEntities> findRawEntities(String snapshotId) {
        List<String> rows = em.createQuery(
                "SELECT e.rawJson FROM SnapshotEntity e WHERE e.id = :id", String.class)
            .setParameter("id", snapshotId)
            .getResultList();
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(codec.read(snapshotId, rows.get(0)));
    }

    @Override
    @Transactional
    public void persist(Snapshot snapshot) {
        writeRepo.persistSnapshot(snapshot);
    }

    @Override
    @Transactional
    public void update(Snapshot snapshot) {
        writeRepo.updateSnapshot(snapshot);
    }

    @Override
    @Transactional
    public void storeRawEntities(String snapshotId, RawEntities rawEntities) {
        writeRepo.updateRawJson(snapshotId, codec.write(rawEntities));
    }
}
