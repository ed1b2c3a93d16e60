package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "administrative_divisions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdministrativeDivisionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "provincial_divisions")
    private Integer provincialDivisions;

    @Column(name = "district_divisions")
    private Integer districtDivisions;
}
