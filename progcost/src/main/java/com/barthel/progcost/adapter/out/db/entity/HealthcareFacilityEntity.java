package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "healthcare_facilities")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthcareFacilityEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "regional_hospitals")
    private Integer regionalHospitals;

    @Column(name = "provincial_hospitals")
    private Integer provincialHospitals;

    @Column(name = "district_hospitals")
    private Integer districtHospitals;

    @Column(name = "health_centres")
    private Integer healthCentres;

    @Column(name = "health_posts")
    private Integer healthPosts;
}
