package com.t2aassist.repository;

import com.t2aassist.model.reference.CcamCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for CCAM codes. The table is owned by the ingestion pipeline;
 * this application only reads it when building a data snapshot.
 */
@Repository
public interface CcamCodeRepository extends JpaRepository<CcamCode, String> {
}
