package edge.vintage;

import com.google.common.base.Preconditions;
import edge.choice.logit.NestNode;
import edge.choice.logit.NestTopology;
import edge.utils.exception.FleetIntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds yearly new-vehicle outcomes into an age-structured fleet. Every year the existing cohorts age
 * along their survival schedule, new sales fill the gap between demand and the surviving fleet, and
 * the stock composition, price and intensity are the quantity-weighted blend of all cohorts.
 * <p>
 * Years of one region must be advanced in increasing order; regions are independent of each other.
 */
public class VintageStockTracker {
    private static final Logger log = LoggerFactory.getLogger(VintageStockTracker.class);

    private static final double SHARE_TOLERANCE = 1e-6;

    private final NestTopology topology;
    private final SurvivalSchedules schedules;

    public VintageStockTracker(NestTopology topology, SurvivalSchedules schedules) {
        this.topology = topology;
        this.schedules = schedules;
    }

    /**
     * Runs the whole fold for one region: the first input seeds a steady-state fleet, every later one
     * advances it.
     */
    public List<StockSnapshot> run(String region, List<VintageInput> inputs) {
        Preconditions.checkArgument(!inputs.isEmpty(), "No vintage inputs for %s", region);
        List<StockSnapshot> snapshots = new ArrayList<>(inputs.size());
        StockSnapshot current = initialize(region, inputs.get(0));
        snapshots.add(current);
        for (int i = 1; i < inputs.size(); i++) {
            current = advance(current.getFleet(), inputs.get(i));
            snapshots.add(current);
        }
        return snapshots;
    }

    /**
     * Fleet in equilibrium with the given year: constant past sales with this year's composition,
     * so stock shares equal new-sales shares.
     */
    public StockSnapshot initialize(String region, VintageInput input) {
        checkInput(region, input);
        List<VintageCohort> cohorts = new ArrayList<>();
        for (NestNode alternative : topology.getAlternatives()) {
            double share = input.getShares().getOrDefault(alternative.getName(), 0.0);
            if (share <= 0.0) continue;
            SurvivalSchedule schedule = schedules.forTechnology(alternative.getTechnology());
            double survivingYears = 0.0;
            for (int age = 0; age < schedule.getMaxServiceLife(); age++) {
                survivingYears += schedule.getSurvival(age);
            }
            double annualSales = input.getTotalDemand() * share / survivingYears;
            for (int age = schedule.getMaxServiceLife() - 1; age >= 0; age--) {
                double quantity = annualSales * schedule.getSurvival(age);
                if (quantity <= 0.0) continue;
                cohorts.add(newCohort(region, alternative, input, input.getYear() - age, annualSales, quantity));
            }
        }
        FleetState fleet = new FleetState(region, input.getYear(), cohorts);
        log.debug("Initialised fleet of {} in {} with {} cohorts", region, input.getYear(), cohorts.size());
        return summarize(fleet, fleet.getTotalQuantity(), 0.0);
    }

    /**
     * @throws FleetIntegrityException if any input or aged quantity is negative or NaN
     */
    public StockSnapshot advance(FleetState prior, VintageInput input) {
        String region = prior.getRegion();
        int year = input.getYear();
        Preconditions.checkArgument(year > prior.getYear(),
                "Fleet of %s is at %s and cannot advance to %s", region, prior.getYear(), year);
        checkInput(region, input);

        List<VintageCohort> cohorts = new ArrayList<>();
        double retirements = 0.0;
        double survivors = 0.0;
        for (VintageCohort cohort : prior.getCohorts()) {
            double survival = schedules.forTechnology(cohort.getTechnology()).getSurvival(cohort.getAge(year));
            double aged = cohort.getInitialQuantity() * survival;
            if (Double.isNaN(aged) || aged < 0.0) {
                throw new FleetIntegrityException("Aged cohort quantity is " + aged, region,
                        cohort.getAlternative() + "@" + cohort.getPurchaseYear(), year);
            }
            retirements += cohort.getQuantity() - aged;
            if (aged > 0.0) {
                cohorts.add(cohort.withQuantity(aged));
                survivors += aged;
            }
        }

        double newSales = Math.max(0.0, input.getTotalDemand() - survivors);
        for (NestNode alternative : topology.getAlternatives()) {
            double share = input.getShares().getOrDefault(alternative.getName(), 0.0);
            double quantity = share * newSales;
            if (quantity > 0.0) {
                cohorts.add(newCohort(region, alternative, input, year, quantity, quantity));
            }
        }
        return summarize(new FleetState(region, year, cohorts), newSales, retirements);
    }

    private static VintageCohort newCohort(String region, NestNode alternative, VintageInput input, int purchaseYear,
                                           double initialQuantity, double quantity) {
        String name = alternative.getName();
        Double price = input.getPrices().get(name);
        Double intensity = input.getIntensities().get(name);
        if (price == null || intensity == null || Double.isNaN(price) || Double.isNaN(intensity) || intensity < 0.0) {
            throw new FleetIntegrityException("New vehicles without valid price (" + price + ") or intensity (" + intensity + ")",
                    region, name, input.getYear());
        }
        return new VintageCohort(region, name, alternative.getVehicleType(), alternative.getTechnology(), purchaseYear,
                initialQuantity, quantity, price, intensity);
    }

    private static void checkInput(String region, VintageInput input) {
        if (Double.isNaN(input.getTotalDemand()) || input.getTotalDemand() < 0.0) {
            throw new FleetIntegrityException("Total demand is " + input.getTotalDemand(), region, null, input.getYear());
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> share : input.getShares().entrySet()) {
            double value = share.getValue();
            if (Double.isNaN(value) || value < 0.0) {
                throw new FleetIntegrityException("New-sales share is " + value, region, share.getKey(), input.getYear());
            }
            sum += value;
        }
        if (input.getTotalDemand() > 0.0 && Math.abs(sum - 1.0) > SHARE_TOLERANCE) {
            throw new FleetIntegrityException("New-sales shares sum to " + sum, region, null, input.getYear());
        }
    }

    private static StockSnapshot summarize(FleetState fleet, double newSales, double retirements) {
        Map<String, Double> quantities = new LinkedHashMap<>();
        Map<String, Double> priceSums = new LinkedHashMap<>();
        Map<String, Double> intensitySums = new LinkedHashMap<>();
        double total = 0.0;
        double totalPrice = 0.0;
        double totalIntensity = 0.0;
        for (VintageCohort cohort : fleet.getCohorts()) {
            double quantity = cohort.getQuantity();
            if (Double.isNaN(quantity) || quantity < 0.0) {
                throw new FleetIntegrityException("Cohort quantity is " + quantity, fleet.getRegion(),
                        cohort.getAlternative() + "@" + cohort.getPurchaseYear(), fleet.getYear());
            }
            quantities.merge(cohort.getAlternative(), quantity, Double::sum);
            priceSums.merge(cohort.getAlternative(), quantity * cohort.getPrice(), Double::sum);
            intensitySums.merge(cohort.getAlternative(), quantity * cohort.getIntensity(), Double::sum);
            total += quantity;
            totalPrice += quantity * cohort.getPrice();
            totalIntensity += quantity * cohort.getIntensity();
        }

        Map<String, Double> shares = new LinkedHashMap<>();
        Map<String, Double> prices = new LinkedHashMap<>();
        Map<String, Double> intensities = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : quantities.entrySet()) {
            String alternative = entry.getKey();
            double quantity = entry.getValue();
            shares.put(alternative, total > 0.0 ? quantity / total : 0.0);
            if (quantity > 0.0) {
                prices.put(alternative, priceSums.get(alternative) / quantity);
                intensities.put(alternative, intensitySums.get(alternative) / quantity);
            }
        }
        return new StockSnapshot(fleet, newSales, retirements, shares, prices, intensities,
                total > 0.0 ? totalPrice / total : Double.NaN,
                total > 0.0 ? totalIntensity / total : Double.NaN);
    }
}
