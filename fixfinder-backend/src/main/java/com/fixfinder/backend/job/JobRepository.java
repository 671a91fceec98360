package com.fixfinder.backend.job;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface JobRepository extends JpaRepository<Job, Long> {

    Page<Job> findByClient_IdAndActiveTrueOrderByCreatedAtDesc(Long clientId, Pageable pageable);

    Page<Job> findByClient_IdAndStatusAndActiveTrueOrderByCreatedAtDesc(Long clientId, JobStatus status, Pageable pageable);

    /**
     * Open jobs a professional may apply to. Empty strings switch a filter off; distance ordering
     * happens in memory because it depends on the caller's coordinates.
     */
    @Query("""
    SELECT j FROM Job j
    WHERE j.active = true
      AND j.status = :status
      AND j.lifecycleState IN :states
      AND j.client.id <> :viewerId
      AND (:category = '' OR LOWER(j.category) = LOWER(:category))
      AND (:city = '' OR LOWER(j.location.city) = LOWER(:city))
      AND (:state = '' OR LOWER(j.location.state) = LOWER(:state))
      AND (:q = ''
           OR LOWER(j.title) LIKE LOWER(CONCAT('%', :q, '%'))
           OR LOWER(j.description) LIKE LOWER(CONCAT('%', :q, '%')))
    ORDER BY j.createdAt DESC
    """)
    List<Job> findFeed(
            @Param("viewerId") Long viewerId,
            @Param("status") JobStatus status,
            @Param("states") Collection<LifecycleState> states,
            @Param("category") String category,
            @Param("city") String city,
            @Param("state") String state,
            @Param("q") String q
    );
}
