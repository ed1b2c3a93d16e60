package com.barthel.progcost.domain.model.reference;

import com.barthel.progcost.domain.exception.MissingSeriesException;
import com.barthel.progcost.domain.exception.NotFoundException;
import com.barthel.progcost.domain.model.CurrencyCodes;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of the nine reference tables with point lookups on their key
 * columns. Lookups never fall back to another key: a missing row raises
 * {@link NotFoundException}.
 * <p>
 * Instances are built once through {@link #builder()} and may be shared between
 * threads. When the source holds several rows for one key, the first row wins and
 * the collision is reported in {@link #integrityWarnings()}.
 */
@Slf4j
public final class ReferenceDataStore {

    public static final String SALARIES = "costs_salaries";
    public static final String PER_DIEMS = "costs_per_diems";
    public static final String TRANSPORT = "costs_transport";
    public static final String SUPPLIES = "office_supplies_and_furniture";
    public static final String DISTANCES = "distance_between_regions";
    public static final String ADMINISTRATIVE_DIVISIONS = "administrative_divisions";
    public static final String HEALTHCARE_FACILITIES = "healthcare_facilities";
    public static final String ECONOMIC_SERIES = "economic_series";
    public static final String POPULATION = "population";

    private final Map<String, SalaryRecord> salaries;
    private final Map<String, PerDiemRecord> perDiems;
    private final Map<String, TransportRecord> transport;
    private final Map<String, SupplyRecord> supplies;
    private final Map<String, DistanceRecord> distances;
    private final Map<String, AdministrativeDivisionRecord> divisions;
    private final Map<String, HealthcareFacilityRecord> facilities;
    private final Map<String, Map<EconomicSeries, EconomicSeriesRecord>> economicSeries;
    private final Map<String, NavigableMap<Integer, BigDecimal>> population;
    private final List<String> integrityWarnings;

    private ReferenceDataStore(Builder builder) {
        this.salaries = Collections.unmodifiableMap(builder.salaries);
        this.perDiems = Collections.unmodifiableMap(builder.perDiems);
        this.transport = Collections.unmodifiableMap(builder.transport);
        this.supplies = Collections.unmodifiableMap(builder.supplies);
        this.distances = Collections.unmodifiableMap(builder.distances);
        this.divisions = Collections.unmodifiableMap(builder.divisions);
        this.facilities = Collections.unmodifiableMap(builder.facilities);
        Map<String, Map<EconomicSeries, EconomicSeriesRecord>> series = new HashMap<>();
        builder.economicValues.forEach((country, bySeries) -> {
            Map<EconomicSeries, EconomicSeriesRecord> records = new EnumMap<>(EconomicSeries.class);
            bySeries.forEach((name, values) -> records.put(name, new EconomicSeriesRecord(country, name, values)));
            series.put(country, Collections.unmodifiableMap(records));
        });
        this.economicSeries = Collections.unmodifiableMap(series);
        Map<String, NavigableMap<Integer, BigDecimal>> populations = new HashMap<>();
        builder.population.forEach((key, values) ->
                populations.put(key, Collections.unmodifiableNavigableMap(values)));
        this.population = Collections.unmodifiableMap(populations);
        this.integrityWarnings = List.copyOf(builder.integrityWarnings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SalaryRecord salary(String country, int cadreLevel) {
        return require(salaries.get(salaryKey(country, cadreLevel)), SALARIES, countryKey(country) + "/" + cadreLevel);
    }

    public PerDiemRecord perDiem(String country) {
        return require(perDiems.get(countryKey(country)), PER_DIEMS, countryKey(country));
    }

    public TransportRecord transport(String vehicleModel) {
        return require(transport.get(itemKey(vehicleModel)), TRANSPORT, itemKey(vehicleModel));
    }

    /**
     * Catalogue lookup; incidental whitespace around the requested and stored names is ignored.
     */
    public SupplyRecord supply(String item) {
        return require(supplies.get(itemKey(item)), SUPPLIES, itemKey(item));
    }

    public DistanceRecord distance(String country) {
        return require(distances.get(countryKey(country)), DISTANCES, countryKey(country));
    }

    public AdministrativeDivisionRecord administrativeDivisions(String country) {
        return require(divisions.get(countryKey(country)), ADMINISTRATIVE_DIVISIONS, countryKey(country));
    }

    public HealthcareFacilityRecord healthcareFacilities(String country) {
        return require(facilities.get(countryKey(country)), HEALTHCARE_FACILITIES, countryKey(country));
    }

    /**
     * @throws MissingSeriesException if the country has no values for the series
     */
    public EconomicSeriesRecord economicSeries(String country, EconomicSeries series) {
        Map<EconomicSeries, EconomicSeriesRecord> bySeries = economicSeries.get(countryKey(country));
        EconomicSeriesRecord record = bySeries == null ? null : bySeries.get(series);
        if (record == null || record.yearlyValues().isEmpty()) {
            throw new MissingSeriesException(countryKey(country), series);
        }
        return record;
    }

    public boolean hasEconomicSeries(String country, EconomicSeries series) {
        Map<EconomicSeries, EconomicSeriesRecord> bySeries = economicSeries.get(countryKey(country));
        return bySeries != null && bySeries.containsKey(series) && !bySeries.get(series).yearlyValues().isEmpty();
    }

    /**
     * Population series of a country, year to thousands of people.
     */
    public NavigableMap<Integer, BigDecimal> population(String country, String variant) {
        return require(population.get(populationKey(country, variant)), POPULATION,
                countryKey(country) + "/" + variant);
    }

    /**
     * ISO3 codes present in any country-keyed table, sorted.
     */
    public List<String> countryCodes() {
        Set<String> codes = new TreeSet<>();
        salaries.values().forEach(r -> codes.add(r.country()));
        codes.addAll(perDiems.keySet());
        codes.addAll(distances.keySet());
        codes.addAll(divisions.keySet());
        codes.addAll(facilities.keySet());
        codes.addAll(economicSeries.keySet());
        population.keySet().forEach(key -> codes.add(key.substring(0, key.indexOf('/'))));
        return List.copyOf(codes);
    }

    /**
     * Currencies that can be rebased to: US dollars, international dollars and every
     * other country with a PPP conversion series.
     */
    public List<String> currencyCodes() {
        List<String> codes = new ArrayList<>();
        codes.add(CurrencyCodes.US_DOLLAR);
        codes.add(CurrencyCodes.INTERNATIONAL_DOLLAR);
        new TreeSet<>(economicSeries.keySet()).stream()
                .filter(country -> !CurrencyCodes.UNITED_STATES.equals(country))
                .filter(country -> hasEconomicSeries(country, EconomicSeries.PPP_CONVERSION_FACTOR))
                .forEach(codes::add);
        return List.copyOf(codes);
    }

    public List<String> integrityWarnings() {
        return integrityWarnings;
    }

    /**
     * Row counts per table, for load diagnostics.
     */
    public Map<String, Integer> rowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put(SALARIES, salaries.size());
        counts.put(PER_DIEMS, perDiems.size());
        counts.put(TRANSPORT, transport.size());
        counts.put(SUPPLIES, supplies.size());
        counts.put(DISTANCES, distances.size());
        counts.put(ADMINISTRATIVE_DIVISIONS, divisions.size());
        counts.put(HEALTHCARE_FACILITIES, facilities.size());
        counts.put(ECONOMIC_SERIES, economicSeries.values().stream()
                .flatMap(m -> m.values().stream())
                .mapToInt(r -> r.yearlyValues().size())
                .sum());
        counts.put(POPULATION, population.values().stream().mapToInt(Map::size).sum());
        return counts;
    }

    private static <T> T require(T record, String table, String key) {
        if (record == null) {
            throw new NotFoundException(table, key);
        }
        return record;
    }

    static String countryKey(String country) {
        return country == null ? "" : country.trim().toUpperCase(Locale.ROOT);
    }

    static String itemKey(String item) {
        return item == null ? "" : item.trim();
    }

    private static String salaryKey(String country, int cadreLevel) {
        return countryKey(country) + "/" + cadreLevel;
    }

    private static String populationKey(String country, String variant) {
        return countryKey(country) + "/" + (variant == null ? "" : variant.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Collects rows table by table. Not thread-safe.
     */
    public static final class Builder {

        private final Map<String, SalaryRecord> salaries = new HashMap<>();
        private final Map<String, PerDiemRecord> perDiems = new HashMap<>();
        private final Map<String, TransportRecord> transport = new HashMap<>();
        private final Map<String, SupplyRecord> supplies = new HashMap<>();
        private final Map<String, DistanceRecord> distances = new HashMap<>();
        private final Map<String, AdministrativeDivisionRecord> divisions = new HashMap<>();
        private final Map<String, HealthcareFacilityRecord> facilities = new HashMap<>();
        private final Map<String, Map<EconomicSeries, NavigableMap<Integer, BigDecimal>>> economicValues = new HashMap<>();
        private final Map<String, NavigableMap<Integer, BigDecimal>> population = new HashMap<>();
        private final List<String> integrityWarnings = new ArrayList<>();

        private Builder() {
        }

        public Builder salary(SalaryRecord record) {
            put(salaries, SALARIES, salaryKey(record.country(), record.cadreLevel()), record);
            return this;
        }

        public Builder perDiem(PerDiemRecord record) {
            put(perDiems, PER_DIEMS, countryKey(record.country()), record);
            return this;
        }

        public Builder transport(TransportRecord record) {
            put(transport, TRANSPORT, itemKey(record.vehicleModel()), record);
            return this;
        }

        public Builder supply(SupplyRecord record) {
            put(supplies, SUPPLIES, itemKey(record.item()), record);
            return this;
        }

        public Builder distance(DistanceRecord record) {
            put(distances, DISTANCES, countryKey(record.country()), record);
            return this;
        }

        public Builder administrativeDivisions(AdministrativeDivisionRecord record) {
            put(divisions, ADMINISTRATIVE_DIVISIONS, countryKey(record.country()), record);
            return this;
        }

        public Builder healthcareFacilities(HealthcareFacilityRecord record) {
            put(facilities, HEALTHCARE_FACILITIES, countryKey(record.country()), record);
            return this;
        }

        /**
         * Add a single year of an economic series. Empty cells are skipped.
         */
        public Builder economicValue(String country, EconomicSeries series, int year, BigDecimal value) {
            if (value == null) {
                return this;
            }
            NavigableMap<Integer, BigDecimal> values = economicValues
                    .computeIfAbsent(countryKey(country), c -> new EnumMap<>(EconomicSeries.class))
                    .computeIfAbsent(series, s -> new TreeMap<>());
            put(values, ECONOMIC_SERIES, countryKey(country) + "/" + series + "/" + year, year, value);
            return this;
        }

        public Builder economicSeries(EconomicSeriesRecord record) {
            record.yearlyValues().forEach((year, value) -> economicValue(record.country(), record.series(), year, value));
            return this;
        }

        public Builder population(PopulationRecord record) {
            NavigableMap<Integer, BigDecimal> values = population
                    .computeIfAbsent(populationKey(record.country(), record.variant()), k -> new TreeMap<>());
            put(values, POPULATION, populationKey(record.country(), record.variant()) + "/" + record.year(),
                    record.year(), record.valueInThousands());
            return this;
        }

        public ReferenceDataStore build() {
            return new ReferenceDataStore(this);
        }

        private <K, V> void put(Map<K, V> table, String tableName, String description, K key, V value) {
            if (table.putIfAbsent(key, value) != null) {
                String warning = "Duplicate row in " + tableName + " for key " + description + "; keeping the first";
                log.warn(warning);
                integrityWarnings.add(warning);
            }
        }

        private <V> void put(Map<String, V> table, String tableName, String key, V value) {
            put(table, tableName, key, key, value);
        }
    }
}
