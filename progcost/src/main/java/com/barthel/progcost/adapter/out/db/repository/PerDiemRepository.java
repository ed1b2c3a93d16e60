package com.barthel.progcost.adapter.out.db.repository;

import com.barthel.progcost.adapter.out.db.entity.PerDiemEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PerDiemRepository extends JpaRepository<PerDiemEntity, Long> {
}
