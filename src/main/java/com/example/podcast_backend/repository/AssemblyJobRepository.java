package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.util.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface AssemblyJobRepository extends JpaRepository<AssemblyJob, UUID> {
    @Query("""
       select distinct j from AssemblyJob j
         join fetch j.owner
         join fetch j.mainContent
         left join fetch j.template
         left join fetch j.inputs
        where j.id = :id
    """)
    Optional<AssemblyJob> findForAssembly(@Param("id") UUID id);

    @Query("""
       select distinct m.id from AssemblyJob j
         join j.inputs m
        where j.status in :statuses
    """)
    Set<UUID> findInputMediaIdsByStatusIn(@Param("statuses") Collection<JobStatus> statuses);

    @Query("""
       select case when count(j) > 0 then true else false end from AssemblyJob j
         join j.inputs m
        where m.id = :mediaId and j.status in :statuses
    """)
    boolean existsByInputsIdAndStatusIn(@Param("mediaId") UUID mediaId, @Param("statuses") Collection<JobStatus> statuses);

    List<AssemblyJob> findByStatusAndUpdatedAtBefore(JobStatus status, Instant cutoff);
}
