package org.example.stylelock.repository;

import org.example.stylelock.entity.LockedStyleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LockedStyleRepository extends JpaRepository<LockedStyleEntity, String> {

    Optional<LockedStyleEntity> findByProjectIdAndActiveTrue(String projectId);

    List<LockedStyleEntity> findByProjectIdOrderByVersionDesc(String projectId);

    @Query("""
            SELECT COALESCE(MAX(s.version), 0)
            FROM LockedStyleEntity s
            WHERE s.projectId = :projectId
            """)
    int findLatestVersion(@Param("projectId") String projectId);
}
