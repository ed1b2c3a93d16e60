package com.barthel.progcost.adapter.out.db.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "costs_transport")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_model", nullable = false)
    private String vehicleModel;

    @Column(name = "operating_cost_per_km")
    private BigDecimal operatingCostPerKm;

    @Column(name = "consumption_litres_per_km")
    private BigDecimal consumptionLitresPerKm;

    private String currency;

    @Column(name = "currency_year")
    private Integer currencyYear;
}
