package edge.data.readers;

import com.google.common.base.Preconditions;
import edge.choice.logit.NestTopology;
import edge.data.DemandSeries;
import edge.data.InconvenienceCostTable;
import edge.data.ObservedShareTable;
import edge.data.PriceRecord;
import edge.data.PriceTable;
import edge.data.StructuralIndicatorTable;
import edge.data.ValueOfTimeTable;
import edge.trend.TrendTarget;
import edge.trend.TrendTargets;
import edge.vintage.SurvivalSchedule;
import edge.vintage.SurvivalSchedules;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the clean, unit-consistent input tables into their immutable in-memory form.
 */
public class EdgeInputReader {
    private static final Logger log = LoggerFactory.getLogger(EdgeInputReader.class);

    static final String DEFAULT_TECHNOLOGY = "default";

    private final ICsvReader csvReader;

    public EdgeInputReader() {
        this(new CsvToMap());
    }

    public EdgeInputReader(ICsvReader csvReader) {
        this.csvReader = csvReader;
    }

    public List<Map<String, String>> readRows(String file) throws IOException {
        Path path = Paths.get(file);
        Preconditions.checkArgument(Files.isRegularFile(path), "Input table %s does not exist", file);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Map<String, String>> rows = csvReader.readRows(reader);
            log.info("Read {} rows from {}", rows.size(), file);
            return rows;
        }
    }

    public NestTopology readTopology(String file) throws IOException {
        if (file.toLowerCase().endsWith(".xml")) {
            return NestTopology.fromXml(new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.UTF_8));
        }
        return topology(readRows(file));
    }

    public static NestTopology topology(List<Map<String, String>> rows) {
        NestTopology.Builder builder = NestTopology.builder();
        for (Map<String, String> row : rows) {
            int level = intValue(row, "level");
            String node = text(row, "node_key");
            String parent = row.get("parent_key");
            String vehicleType = row.get("vehicle_type");
            String technology = row.get("technology");
            if (StringUtils.isNotBlank(vehicleType) || StringUtils.isNotBlank(technology)) {
                builder.addAlternative(level, node, parent, vehicleType, technology, row.get("energy_carrier"));
            } else {
                builder.addNest(level, node, parent, doubleValue(row, "exponent"));
            }
        }
        return builder.build();
    }

    public static PriceTable prices(List<Map<String, String>> rows) {
        List<PriceRecord> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            records.add(new PriceRecord(text(row, "region"), text(row, "vehicle_type"), text(row, "technology"),
                    intValue(row, "year"), doubleValue(row, "non_fuel_cost"), doubleValue(row, "fuel_cost"),
                    doubleValue(row, "energy_intensity")));
        }
        return new PriceTable(records);
    }

    public static ObservedShareTable observedShares(List<Map<String, String>> rows) {
        ObservedShareTable.Builder builder = ObservedShareTable.builder();
        for (Map<String, String> row : rows) {
            builder.put(text(row, "region"), text(row, "vehicle_type"), text(row, "technology"),
                    intValue(row, "reference_year"), doubleValue(row, "observed_share"));
        }
        return builder.build();
    }

    public static ValueOfTimeTable valueOfTime(List<Map<String, String>> rows) {
        ValueOfTimeTable.Builder builder = ValueOfTimeTable.builder();
        for (Map<String, String> row : rows) {
            builder.put(text(row, "region"), text(row, "vehicle_type"), intValue(row, "year"),
                    doubleValue(row, "time_cost_per_distance"));
        }
        return builder.build();
    }

    public static InconvenienceCostTable inconvenienceCosts(List<Map<String, String>> rows) {
        InconvenienceCostTable.Builder builder = InconvenienceCostTable.builder();
        for (Map<String, String> row : rows) {
            builder.put(text(row, "region"), text(row, "vehicle_type"), StringUtils.trimToNull(row.get("technology")),
                    intValue(row, "year"), doubleValue(row, "cost_adjustment"));
        }
        return builder.build();
    }

    public static StructuralIndicatorTable clusterIndicators(List<Map<String, String>> rows) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            values.put(text(row, "region"), doubleValue(row, "structural_indicator_value"));
        }
        return new StructuralIndicatorTable(values);
    }

    /**
     * Rows with technology "default" (or blank) replace the default schedule; other rows override
     * single technologies.
     */
    public static SurvivalSchedules survival(List<Map<String, String>> rows, int defaultMaxServiceLife) {
        Map<String, Map<Integer, Double>> points = new TreeMap<>();
        for (Map<String, String> row : rows) {
            String technology = StringUtils.defaultIfBlank(row.get("technology"), DEFAULT_TECHNOLOGY);
            points.computeIfAbsent(technology, t -> new TreeMap<>())
                    .put(intValue(row, "age"), doubleValue(row, "surviving_fraction"));
        }
        SurvivalSchedule defaultSchedule = points.containsKey(DEFAULT_TECHNOLOGY)
                ? SurvivalSchedule.fromPoints(points.remove(DEFAULT_TECHNOLOGY))
                : SurvivalSchedule.defaultSchedule(defaultMaxServiceLife);
        Map<String, SurvivalSchedule> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Integer, Double>> entry : points.entrySet()) {
            overrides.put(entry.getKey(), SurvivalSchedule.fromPoints(entry.getValue()));
        }
        return new SurvivalSchedules(defaultSchedule, overrides);
    }

    public static DemandSeries demand(List<Map<String, String>> rows) {
        DemandSeries.Builder builder = DemandSeries.builder();
        for (Map<String, String> row : rows) {
            builder.put(text(row, "region"), intValue(row, "year"), doubleValue(row, "demand"));
        }
        return builder.build();
    }

    public static TrendTargets trendTargets(List<Map<String, String>> rows) {
        List<TrendTarget> targets = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            targets.add(new TrendTarget(text(row, "cluster"), text(row, "node_key"), doubleValue(row, "target"),
                    intValue(row, "convergence_year"), doubleValue(row, "rate")));
        }
        return TrendTargets.of(targets);
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        Preconditions.checkArgument(StringUtils.isNotBlank(value), "Missing value for column '%s' in row %s", column, row);
        return value;
    }

    private static int intValue(Map<String, String> row, String column) {
        String value = text(row, column);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Column '%s' is not an integer: %s", column, value), e);
        }
    }

    private static double doubleValue(Map<String, String> row, String column) {
        String value = text(row, column);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Column '%s' is not a number: %s", column, value), e);
        }
    }
}
