package com.barthel.progcost.adapter.out.db.repository;

import com.barthel.progcost.adapter.out.db.entity.EconomicSeriesValueEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EconomicSeriesValueRepository extends JpaRepository<EconomicSeriesValueEntity, Long> {
}
