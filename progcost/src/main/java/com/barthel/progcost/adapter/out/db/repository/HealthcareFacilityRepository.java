package com.barthel.progcost.adapter.out.db.repository;

import com.barthel.progcost.adapter.out.db.entity.HealthcareFacilityEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HealthcareFacilityRepository extends JpaRepository<HealthcareFacilityEntity, Long> {
}
