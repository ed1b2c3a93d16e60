package com.barthel.progcost.adapter.out.db.repository;

import com.barthel.progcost.adapter.out.db.entity.DistanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DistanceRepository extends JpaRepository<DistanceEntity, Long> {
}
