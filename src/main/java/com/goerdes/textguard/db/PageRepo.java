package com.goerdes.textguard.db;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PageRepo extends JpaRepository<PageEntity, Long> {

    Optional<PageEntity> findByUrl(String url);

}
