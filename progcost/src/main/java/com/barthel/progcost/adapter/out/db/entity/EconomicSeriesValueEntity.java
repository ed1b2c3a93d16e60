package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "economic_series")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EconomicSeriesValueEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "series_name", nullable = false)
    private String seriesName;

    @Column(name = "series_year", nullable = false)
    private Integer seriesYear;

    @Column(name = "series_value")
    private BigDecimal seriesValue;
}
