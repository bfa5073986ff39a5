package com.theobroma.perf.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.theobroma.perf.domain.Farm;
import com.theobroma.perf.domain.FarmAnalytics;
import com.theobroma.perf.domain.GeoPoint;
import com.theobroma.perf.domain.LotTreeMetrics;
import com.theobroma.perf.domain.SecurityTree;
import com.theobroma.perf.domain.Tree;
import com.theobroma.perf.repository.jooq.PlantationJooqRepository;
import com.theobroma.perf.util.ResourceNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-side plantation operations built on the batch queries of
 * {@link PlantationJooqRepository}.
 *
 * Each operation costs a fixed number of queries: one to resolve the farm (and lot
 * where needed) and one for the data, whatever the number of rows returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlantationService {

    static final int DEFAULT_SECURITY_TREE_LIMIT = 200;
    static final double DEFAULT_READY_THRESHOLD = 80.0;

    /** Pods per tree and maturity point, scaled to a hectare. */
    private static final double YIELD_FACTOR = 0.5;

    private final PlantationJooqRepository repository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public FarmsResponse listFarms() {
        List<Farm> farms = repository.findFarmsWithLocations(null);

        List<String> slugs = new ArrayList<>(farms.size());
        for (Farm farm : farms) {
            slugs.add(farm.slug());
        }
        return new FarmsResponse(slugs, farms.size(), farms);
    }

    /**
     * Lot summaries of a farm, computed from one aggregated query.
     *
     * Lots are visited in lot number order. A lot whose average maturity is below
     * {@code minMaturity} is skipped; at most {@code limit} lots are returned.
     * Totals cover the returned lots only.
     *
     * @param farmSlug farm identifier
     * @param limit maximum number of lots, null for all
     * @param minMaturity minimum average maturity, null or 0 for no filter
     * @return lot summaries with totals
     * @throws ResourceNotFoundException if the farm does not exist
     */
    @Transactional(readOnly = true)
    public LotsResponse getLotsSummary(String farmSlug, Integer limit, Double minMaturity) {
        Farm farm = requireFarm(farmSlug);

        List<LotSummary> summaries = new ArrayList<>();
        long totalTrees = 0;
        BigDecimal totalArea = BigDecimal.ZERO;

        for (LotTreeMetrics lot : repository.findLotsWithTreeMetrics(farm.id(), null)) {
            if (minMaturity != null && minMaturity > 0 && lot.avgMaturity() < minMaturity) {
                continue;
            }

            BigDecimal area = lot.areaHectares() == null ? BigDecimal.ZERO : lot.areaHectares();
            summaries.add(new LotSummary(
                lot.lotNumber(),
                lot.treeCount(),
                lot.healthyTrees(),
                lot.unhealthyTrees(),
                lot.totalSecurityEvents(),
                lot.avgMaturity(),
                lot.avgHeight(),
                lot.avgFungalThreat(),
                area,
                lot.lastTreeInspection(),
                lot.centroid()
            ));
            totalTrees += lot.treeCount();
            totalArea = totalArea.add(area);

            if (limit != null && summaries.size() >= limit) {
                break;
            }
        }

        log.debug("Lots summary for farm {}: {} lots, {} trees", farmSlug, summaries.size(), totalTrees);
        return new LotsResponse(summaries, summaries.size(), totalArea, totalTrees);
    }

    /**
     * Trees of one lot with their coordinates.
     *
     * @throws ResourceNotFoundException if the farm or the lot does not exist
     */
    @Transactional(readOnly = true)
    public LotTreesResponse getLotTrees(String farmSlug, int lotNumber, Integer limit) {
        Farm farm = requireFarm(farmSlug);
        Long lotId = repository.findLotId(farm.id(), lotNumber)
            .orElseThrow(() -> new ResourceNotFoundException(
                "Lot " + lotNumber + " not found in farm " + farmSlug));

        List<Tree> trees = repository.findTreesWithLocations(lotId, null, limit);
        return new LotTreesResponse(trees, trees.size(), lotNumber, farmSlug);
    }

    /**
     * Trees with recorded security events, most affected first.
     *
     * @throws ResourceNotFoundException if the farm does not exist
     */
    @Transactional(readOnly = true)
    public SecurityTreesResponse getSecurityTrees(String farmSlug, Integer lotNumber, int minEvents, Integer limit) {
        if (minEvents < 1) {
            throw new IllegalArgumentException("min_events must be at least 1");
        }
        Farm farm = requireFarm(farmSlug);

        int effectiveLimit = limit != null ? limit : DEFAULT_SECURITY_TREE_LIMIT;
        List<SecurityTree> trees =
            repository.findSecurityTreesWithLocations(farm.id(), lotNumber, minEvents, effectiveLimit);

        long totalEvents = 0;
        for (SecurityTree tree : trees) {
            totalEvents += tree.securityEventsCount();
        }
        return new SecurityTreesResponse(trees, trees.size(), totalEvents, farmSlug);
    }

    /**
     * @throws ResourceNotFoundException if the farm does not exist
     */
    @Transactional(readOnly = true)
    public FarmAnalytics getFarmAnalytics(String farmSlug) {
        Farm farm = requireFarm(farmSlug);
        return repository.findFarmAnalyticsSummary(farm.id())
            .orElseThrow(() -> new ResourceNotFoundException("Farm not found: " + farmSlug));
    }

    /**
     * Yield and quality estimates per lot, from the same aggregated lot query as the
     * lots summary.
     *
     * A lot is ready for harvest when its average maturity reaches
     * {@code readyThreshold}; its optimal harvest date is then today, otherwise null.
     * A lot without trees yields nothing and scores full quality.
     *
     * @param farmSlug farm identifier
     * @param readyThreshold maturity at which a lot is ready, null for 80
     * @throws ResourceNotFoundException if the farm does not exist
     */
    @Transactional(readOnly = true)
    public ProductionAnalyticsResponse getProductionAnalytics(String farmSlug, Double readyThreshold) {
        double threshold = readyThreshold != null ? readyThreshold : DEFAULT_READY_THRESHOLD;
        Farm farm = requireFarm(farmSlug);
        LocalDate today = LocalDate.now(clock);

        List<ProductionMetrics> metrics = new ArrayList<>();
        double totalYield = 0.0;
        double totalQuality = 0.0;
        int readyLots = 0;

        for (LotTreeMetrics lot : repository.findLotsWithTreeMetrics(farm.id(), null)) {
            double maturity = lot.avgMaturity();
            double yieldPerHectare = Math.max(0.0, maturity / 100.0 * lot.treeCount() * YIELD_FACTOR);
            double area = lot.areaHectares() == null ? 0.0 : lot.areaHectares().doubleValue();
            double estimatedYield = area * yieldPerHectare;
            double quality = Math.min(100.0, Math.max(0.0, 100.0 - lot.avgFungalThreat() + maturity * 0.5));
            boolean ready = maturity >= threshold;

            metrics.add(new ProductionMetrics(lot.lotNumber(), estimatedYield, maturity, quality,
                ready ? today : null));
            totalYield += estimatedYield;
            totalQuality += quality;
            if (ready) {
                readyLots++;
            }
        }

        double averageQuality = metrics.isEmpty() ? 0.0 : totalQuality / metrics.size();
        log.debug("Production analytics for farm {}: {} lots, {} ready", farmSlug, metrics.size(), readyLots);
        return new ProductionAnalyticsResponse(metrics, oneDecimal(totalYield), oneDecimal(averageQuality), readyLots);
    }

    private static double oneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private Farm requireFarm(String farmSlug) {
        return repository.findFarmBySlug(farmSlug)
            .orElseThrow(() -> new ResourceNotFoundException("Farm not found: " + farmSlug));
    }

    // =========================================================================
    // Response types
    // =========================================================================

    public record FarmsResponse(List<String> farms, int totalFarms, List<Farm> farmsData) {}

    public record LotSummary(
        int lotId,
        long totalTrees,
        long healthyTrees,
        long unhealthyTrees,
        long securityEvents,
        double avgMaturity,
        double avgHeight,
        double avgFungalThreat,
        BigDecimal areaHectares,
        LocalDate lastInspection,
        GeoPoint centroid
    ) {}

    public record LotsResponse(List<LotSummary> lots, int totalLots, BigDecimal totalArea, long totalTrees) {}

    public record LotTreesResponse(List<Tree> trees, int totalTrees, int lotId, String farmId) {}

    public record SecurityTreesResponse(
        List<SecurityTree> trees,
        int totalTrees,
        long totalSecurityEvents,
        String farmId
    ) {}

    public record ProductionMetrics(
        int lotId,
        double estimatedYield,
        double harvestReadiness,
        double qualityScore,
        LocalDate optimalHarvestDate
    ) {}

    public record ProductionAnalyticsResponse(
        List<ProductionMetrics> productionMetrics,
        double totalEstimatedYield,
        double averageQualityScore,
        int lotsReadyForHarvest
    ) {}
}
