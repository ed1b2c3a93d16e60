package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "population")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PopulationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "pop_year", nullable = false)
    private Integer popYear;

    @Column(nullable = false)
    private String variant;

    @Column(name = "value_thousands", nullable = false)
    private BigDecimal valueThousands;
}
