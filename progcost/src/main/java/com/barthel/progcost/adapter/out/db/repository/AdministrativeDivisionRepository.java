package com.barthel.progcost.adapter.out.db.repository;

import com.barthel.progcost.adapter.out.db.entity.AdministrativeDivisionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AdministrativeDivisionRepository extends JpaRepository<AdministrativeDivisionEntity, Long> {
}
