package com.example.catalogsync.repository;

import com.example.catalogsync.entity.SyncRun;
import com.example.catalogsync.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

    List<SyncRun> findAllByOrderByStartedAtDesc();

    List<SyncRun> findByFamilyOrderByStartedAtDesc(String family);

    Optional<SyncRun> findFirstByFamilyOrderByStartedAtDesc(String family);

    List<SyncRun> findByStatus(RunStatus status);
}
