package com.barthel.progcost.adapter.out.db;

import com.barthel.progcost.adapter.out.db.entity.*;
import com.barthel.progcost.adapter.out.db.repository.*;
import com.barthel.progcost.application.port.out.LoadReferenceDataPort;
import com.barthel.progcost.domain.model.reference.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the reference tables once and serves the resulting snapshot to every run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReferenceDataDbAdapter implements LoadReferenceDataPort {

    private static final Sort BY_ID = Sort.by("id");

    private final SalaryRepository salaryRepository;
    private final PerDiemRepository perDiemRepository;
    private final TransportRepository transportRepository;
    private final SupplyRepository supplyRepository;
    private final DistanceRepository distanceRepository;
    private final AdministrativeDivisionRepository administrativeDivisionRepository;
    private final HealthcareFacilityRepository healthcareFacilityRepository;
    private final EconomicSeriesValueRepository economicSeriesValueRepository;
    private final PopulationRepository populationRepository;

    private volatile ReferenceDataStore snapshot;

    @Override
    public ReferenceDataStore loadReferenceData() {
        ReferenceDataStore current = snapshot;
        if (current == null) {
            synchronized (this) {
                current = snapshot;
                if (current == null) {
                    current = readSnapshot();
                    snapshot = current;
                }
            }
        }
        return current;
    }

    private ReferenceDataStore readSnapshot() {
        ReferenceDataStore.Builder builder = ReferenceDataStore.builder();
        salaryRepository.findAll(BY_ID).forEach(e -> builder.salary(toRecord(e)));
        perDiemRepository.findAll(BY_ID).forEach(e -> builder.perDiem(toRecord(e)));
        transportRepository.findAll(BY_ID).forEach(e -> builder.transport(toRecord(e)));
        supplyRepository.findAll(BY_ID).forEach(e -> builder.supply(toRecord(e)));
        distanceRepository.findAll(BY_ID).forEach(e -> builder.distance(toRecord(e)));
        administrativeDivisionRepository.findAll(BY_ID).forEach(e -> builder.administrativeDivisions(toRecord(e)));
        healthcareFacilityRepository.findAll(BY_ID).forEach(e -> builder.healthcareFacilities(toRecord(e)));
        for (EconomicSeriesValueEntity e : economicSeriesValueRepository.findAll(BY_ID)) {
            Optional<EconomicSeries> series = EconomicSeries.fromStoredName(e.getSeriesName());
            if (series.isEmpty()) {
                log.debug("Skipping unused economic series '{}' for {}", e.getSeriesName(), e.getIso3());
                continue;
            }
            builder.economicValue(e.getIso3(), series.get(), e.getSeriesYear(), e.getSeriesValue());
        }
        populationRepository.findAll(BY_ID).forEach(e -> builder.population(toRecord(e)));

        ReferenceDataStore store = builder.build();
        log.info("Loaded reference data: {}", store.rowCounts());
        if (!store.integrityWarnings().isEmpty()) {
            log.warn("Reference data has {} integrity warnings", store.integrityWarnings().size());
        }
        return store;
    }

    private static SalaryRecord toRecord(SalaryEntity e) {
        return new SalaryRecord(e.getIso3(), e.getIscoLevel(), e.getAnnualSalary(), e.getCurrency(), e.getCurrencyYear());
    }

    private static PerDiemRecord toRecord(PerDiemEntity e) {
        return new PerDiemRecord(e.getIso3(), e.getDsaNational(), e.getDsaUpper(), e.getDsaLower(),
                e.getCurrency(), e.getCurrencyYear(), e.getLocalProportion());
    }

    private static TransportRecord toRecord(TransportEntity e) {
        return new TransportRecord(e.getVehicleModel(), e.getOperatingCostPerKm(), e.getConsumptionLitresPerKm(),
                e.getCurrency(), e.getCurrencyYear());
    }

    private static SupplyRecord toRecord(SupplyEntity e) {
        return new SupplyRecord(e.getItem(), e.getPrice(), e.getCurrency(), e.getCurrencyYear());
    }

    private static DistanceRecord toRecord(DistanceEntity e) {
        Map<Integer, BigDecimal> percentiles = new LinkedHashMap<>();
        putIfPresent(percentiles, 10, e.getDdist10());
        putIfPresent(percentiles, 20, e.getDdist20());
        putIfPresent(percentiles, 30, e.getDdist30());
        putIfPresent(percentiles, 40, e.getDdist40());
        putIfPresent(percentiles, 50, e.getDdist50());
        putIfPresent(percentiles, 60, e.getDdist60());
        putIfPresent(percentiles, 70, e.getDdist70());
        putIfPresent(percentiles, 80, e.getDdist80());
        putIfPresent(percentiles, 90, e.getDdist90());
        putIfPresent(percentiles, 95, e.getDdist95());
        putIfPresent(percentiles, 100, e.getDdist100());
        return new DistanceRecord(e.getIso3(), percentiles, e.getSizeKmSq());
    }

    private static AdministrativeDivisionRecord toRecord(AdministrativeDivisionEntity e) {
        return new AdministrativeDivisionRecord(e.getIso3(), zeroIfNull(e.getProvincialDivisions()),
                zeroIfNull(e.getDistrictDivisions()));
    }

    private static HealthcareFacilityRecord toRecord(HealthcareFacilityEntity e) {
        return new HealthcareFacilityRecord(e.getIso3(),
                zeroIfNull(e.getRegionalHospitals()),
                zeroIfNull(e.getProvincialHospitals()),
                zeroIfNull(e.getDistrictHospitals()),
                zeroIfNull(e.getHealthCentres()),
                zeroIfNull(e.getHealthPosts()));
    }

    private static PopulationRecord toRecord(PopulationEntity e) {
        return new PopulationRecord(e.getIso3(), e.getPopYear(), e.getVariant(), e.getValueThousands());
    }

    private static void putIfPresent(Map<Integer, BigDecimal> percentiles, int percentile, BigDecimal value) {
        if (value != null) {
            percentiles.put(percentile, value);
        }
    }

    private static int zeroIfNull(Integer value) {
        return value == null ? 0 : value;
    }
}
