package com.t2aassist.repository;

import com.t2aassist.model.reference.Incompatibility;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IncompatibilityRepository extends JpaRepository<Incompatibility, Long> {
}
