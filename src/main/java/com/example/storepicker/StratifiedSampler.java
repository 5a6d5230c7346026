package com.example.storepicker;

import com.example.storepicker.allocation.QuotaAllocator;
import com.example.storepicker.model.UnitRecord;
import com.example.storepicker.model.UnitTable;
import com.example.storepicker.random.SeededRandomSource;
import com.example.storepicker.strata.StratumKey;
import com.example.storepicker.strata.StratumKeyBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Stratified random sample of a population table.
 * <p>
 * Rows without an identifier are dropped, the remaining rows are grouped by their normalized
 * stratification values, quotas are computed with {@link QuotaAllocator}, and each stratum is
 * sampled without replacement. If the strata together come up short, the rest is drawn from
 * all rows not yet selected.
 */
public class StratifiedSampler {

    private static final Logger logger = LogManager.getLogger(StratifiedSampler.class);

    public List<UnitRecord> sample(UnitTable table, String idColumn, List<String> stratColumns,
                                   int targetN, Long seed) {
        return sample(table, idColumn, stratColumns, targetN, seed, 1);
    }

    /**
     * @param table         population, one row per unit
     * @param idColumn      unique identifier column
     * @param stratColumns  columns defining the strata
     * @param targetN       desired total sample size
     * @param seed          seed for reproducibility, or {@code null}
     * @param minPerStratum minimum units to try to take from each stratum
     * @return the selected rows, stratification columns normalized
     * @throws SamplingConfigurationException if a named column is not in the table
     */
    public List<UnitRecord> sample(UnitTable table, String idColumn, List<String> stratColumns,
                                   int targetN, Long seed, int minPerStratum) {
        if (!table.hasColumn(idColumn)) {
            throw SamplingConfigurationException.missingIdColumn(idColumn);
        }
        List<String> missing = stratColumns.stream()
                .filter(c -> !table.hasColumn(c))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw SamplingConfigurationException.missingStratificationColumns(missing);
        }

        StratumKeyBuilder keyBuilder = new StratumKeyBuilder(stratColumns);

        // Drop rows without an ID and standardise the stratification columns
        List<UnitRecord> units = new ArrayList<>();
        for (UnitRecord row : table.rows()) {
            if (row.isMissing(idColumn)) {
                continue;
            }
            UnitRecord unit = row.copy();
            for (String column : stratColumns) {
                unit.set(column, StratumKeyBuilder.normalize(row.get(column)));
            }
            units.add(unit);
        }
        if (units.size() < table.size()) {
            logger.info("Dropped {} rows without a value in {}", table.size() - units.size(), idColumn);
        }
        warnOnDuplicateIds(units, idColumn);

        Map<StratumKey, List<UnitRecord>> strata = new TreeMap<>();
        for (UnitRecord unit : units) {
            strata.computeIfAbsent(keyBuilder.build(unit), k -> new ArrayList<>()).add(unit);
        }
        Map<StratumKey, Integer> capacities = new LinkedHashMap<>();
        strata.forEach((key, members) -> capacities.put(key, members.size()));

        int totalTarget = Math.min(targetN, units.size());
        Map<StratumKey, Integer> quotas = QuotaAllocator.allocate(totalTarget, capacities, minPerStratum);
        logger.info("Sampling {} of {} units across {} strata", totalTarget, units.size(), strata.size());

        SeededRandomSource random = new SeededRandomSource(seed);
        List<UnitRecord> selected = new ArrayList<>();
        Set<String> selectedIds = new HashSet<>();

        for (Map.Entry<StratumKey, Integer> e : quotas.entrySet()) {
            int quota = e.getValue();
            if (quota <= 0) {
                continue;
            }
            List<UnitRecord> members = strata.get(e.getKey());
            SeededRandomSource.SubStream draw = random.nextSubStream();
            int[] picks = draw.drawIndices(members.size(), quota);
            logger.debug("Stratum [{}]: quota {} of {}, sub-seed {}", e.getKey(), quota, members.size(), draw.seed());
            for (int index : picks) {
                UnitRecord unit = members.get(index);
                selected.add(unit);
                selectedIds.add(unit.get(idColumn));
            }
        }

        // Top-up globally if the strata came up short
        if (selected.size() < totalTarget) {
            int need = totalTarget - selected.size();
            List<UnitRecord> remaining = units.stream()
                    .filter(u -> !selectedIds.contains(u.get(idColumn)))
                    .collect(Collectors.toList());
            if (!remaining.isEmpty()) {
                SeededRandomSource.SubStream draw = random.nextSubStream();
                int[] picks = draw.drawIndices(remaining.size(), need);
                for (int index : picks) {
                    UnitRecord unit = remaining.get(index);
                    selected.add(unit);
                    selectedIds.add(unit.get(idColumn));
                }
                logger.info("Topped up {} units from a pool of {}", picks.length, remaining.size());
            }
        }

        return selected;
    }

    private static void warnOnDuplicateIds(List<UnitRecord> units, String idColumn) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (UnitRecord unit : units) {
            if (!seen.add(unit.get(idColumn))) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            logger.warn("{} rows repeat an existing {} value; a repeated ID can be selected more than once",
                    duplicates, idColumn);
        }
    }
}
