package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "costs_per_diems")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerDiemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "dsa_national")
    private BigDecimal dsaNational;

    @Column(name = "dsa_upper")
    private BigDecimal dsaUpper;

    @Column(name = "dsa_lower")
    private BigDecimal dsaLower;

    private String currency;

    @Column(name = "currency_year")
    private Integer currencyYear;

    @Column(name = "local_proportion")
    private BigDecimal localProportion;
}
