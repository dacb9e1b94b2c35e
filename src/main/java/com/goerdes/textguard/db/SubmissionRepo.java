package com.goerdes.textguard.db;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SubmissionRepo extends JpaRepository<SubmissionEntity, Long> {
}
