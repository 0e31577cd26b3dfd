package com.t2aassist.repository;

import com.t2aassist.model.reference.OfficialAssociation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OfficialAssociationRepository extends JpaRepository<OfficialAssociation, Long> {
}
