package com.goerdes.textguard.db;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReportRepo extends JpaRepository<ReportEntity, Long> {

    List<ReportEntity> findBySubmissionId(Long submissionId);

}
