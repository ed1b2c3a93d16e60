package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "distance_between_regions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DistanceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "iso3", nullable = false, length = 3)
    private String iso3;

    @Column(name = "ddist10")
    private BigDecimal ddist10;

    @Column(name = "ddist20")
    private BigDecimal ddist20;

    @Column(name = "ddist30")
    private BigDecimal ddist30;

    @Column(name = "ddist40")
    private BigDecimal ddist40;

    @Column(name = "ddist50")
    private BigDecimal ddist50;

    @Column(name = "ddist60")
    private BigDecimal ddist60;

    @Column(name = "ddist70")
    private BigDecimal ddist70;

    @Column(name = "ddist80")
    private BigDecimal ddist80;

    @Column(name = "ddist90")
    private BigDecimal ddist90;

    @Column(name = "ddist95")
    private BigDecimal ddist95;

    @Column(name = "ddist100")
    private BigDecimal ddist100;

    @Column(name = "size_km_sq")
    private BigDecimal sizeKmSq;
}
