package com.t2aassist.repository;

import com.t2aassist.model.reference.ObservedAssociation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ObservedAssociationRepository extends JpaRepository<ObservedAssociation, Long> {
}
