package edge.data;

import com.google.common.collect.ImmutableMap;
import edge.utils.exception.MissingPriceException;

import java.util.Collection;
import java.util.Optional;

/**
 * Price and intensity records keyed by (region, vehicle type, technology, year).
 */
public final class PriceTable {

    private final ImmutableMap<String, PriceRecord> records;

    public PriceTable(Collection<PriceRecord> records) {
        ImmutableMap.Builder<String, PriceRecord> builder = ImmutableMap.builder();
        for (PriceRecord record : records) {
            builder.put(TableKey.of(record.getRegion(), record.getVehicleType(), record.getTechnology(), record.getYear()), record);
        }
        this.records = builder.buildOrThrow();
    }

    public Optional<PriceRecord> find(String region, String vehicleType, String technology, int year) {
        return Optional.ofNullable(records.get(TableKey.of(region, vehicleType, technology, year)));
    }

    /**
     * Returns the usable price record of an alternative.
     *
     * @throws MissingPriceException if there is no record or its total price is not strictly positive
     */
    public PriceRecord require(String region, String vehicleType, String technology, int year) {
        PriceRecord record = records.get(TableKey.of(region, vehicleType, technology, year));
        if (record == null) {
            throw new MissingPriceException("No price record", region, vehicleType + "/" + technology, year);
        }
        if (!record.isUsable()) {
            throw new MissingPriceException("Price is zero or invalid (" + record.getTotalPrice() + ")",
                    region, vehicleType + "/" + technology, year);
        }
        return record;
    }

    public int size() {
        return records.size();
    }
}
