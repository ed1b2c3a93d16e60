package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "costs_salaries")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalaryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "isco_08_level", nullable = false)
    private Integer iscoLevel;

    @Column(name = "annual_salary", nullable = false)
    private BigDecimal annualSalary;

    private String currency;

    @Column(name = "currency_year")
    private Integer currencyYear;
}
