package com.fixfinder.backend.professional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface ProfessionalRepository extends JpaRepository<Professional, Long> {

    Optional<Professional> findByUser_Id(Long userId);

    // Single-row increment, mirrors an atomic $inc
    @Transactional
    @Modifying
    @Query("UPDATE Professional p SET p.completedJobs = p.completedJobs + 1 WHERE p.id = :id")
    int incrementCompletedJobs(@Param("id") Long id);
}
