package com.strategyvault.repository;

import com.strategyvault.entity.VaultEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface VaultEventRepository extends JpaRepository<VaultEventEntity, Long> {

    List<VaultEventEntity> findTop100ByOrderByTimestampDescIdDesc();

    List<VaultEventEntity> findTop100ByHolderOrderByTimestampDescIdDesc(String holder);

    List<VaultEventEntity> findTop100ByEventTypeOrderByTimestampDescIdDesc(String eventType);

    /**
     * Delete events older than the retention cutoff.
     *
     * @return rows deleted
     */
    @Modifying
    @Query("DELETE FROM VaultEventEntity e WHERE e.timestamp < :cutoff")
    int deleteByTimestampBefore(@Param("cutoff") Instant cutoff);
}
