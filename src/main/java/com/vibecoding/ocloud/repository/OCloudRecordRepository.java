package com.vibecoding.ocloud.repository;

import com.vibecoding.ocloud.model.ocloud.OCloudRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * O-Cloud 레코드 JPA Repository
 */
@Repository
public interface OCloudRecordRepository extends JpaRepository<OCloudRecord, String> {
}
