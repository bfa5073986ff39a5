package com.theobroma.perf.repository.jooq;

import static org.jooq.impl.DSL.*;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SelectLimitStep;
import org.jooq.Table;
import org.springframework.stereotype.Repository;

import com.theobroma.perf.domain.AggregatedEntityMetrics;
import com.theobroma.perf.domain.Farm;
import com.theobroma.perf.domain.FarmAnalytics;
import com.theobroma.perf.domain.GeoPoint;
import com.theobroma.perf.domain.LotTreeMetrics;
import com.theobroma.perf.domain.SecurityTree;
import com.theobroma.perf.domain.Tree;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * jOOQ repository for farms, lots and trees.
 *
 * Every method answers its question in a single round trip:
 * - coordinates are extracted with ST_Y/ST_X alongside the row, never per row
 * - per-lot tree metrics come from one grouped LEFT JOIN (see {@link BatchFetchPlanner})
 * - farm analytics fold farm, lots and trees into one aggregate row
 *
 * All queries run on the application DSLContext and are therefore timed and counted
 * by the query statistics.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PlantationJooqRepository {

    static final List<String> HEALTHY_STATUSES = List.of("healthy", "excellent", "good");
    static final List<String> UNHEALTHY_STATUSES = List.of("poor", "critical", "dead");

    private final DSLContext dsl;
    private final BatchFetchPlanner planner;

    // Table references (string names, no code generation)
    private static final Table<?> FARMS = table("farms");
    private static final Table<?> LOTS = table("lots");
    private static final Table<?> TREES = table("trees");

    private static final Field<Long> FARMS_ID = field("farms.id", Long.class);
    private static final Field<String> FARMS_NAME = field("farms.name", String.class);
    private static final Field<String> FARMS_SLUG = field("farms.slug", String.class);
    private static final Field<BigDecimal> FARMS_AREA = field("farms.total_area_hectares", BigDecimal.class);
    private static final Field<LocalDate> FARMS_ESTABLISHED = field("farms.established_date", LocalDate.class);
    private static final Field<String> FARMS_EMAIL = field("farms.contact_email", String.class);
    private static final Field<String> FARMS_PHONE = field("farms.contact_phone", String.class);
    private static final Field<Object> FARMS_LOCATION = field("farms.location");

    private static final Field<Long> LOTS_ID = field("lots.id", Long.class);
    private static final Field<Long> LOTS_FARM_ID = field("lots.farm_id", Long.class);
    private static final Field<Integer> LOTS_NUMBER = field("lots.lot_number", Integer.class);
    private static final Field<BigDecimal> LOTS_AREA = field("lots.area_hectares", BigDecimal.class);

    private static final Field<Long> TREES_ID = field("trees.id", Long.class);
    private static final Field<Long> TREES_FARM_ID = field("trees.farm_id", Long.class);
    private static final Field<Long> TREES_LOT_ID = field("trees.lot_id", Long.class);
    private static final Field<String> TREES_CODE = field("trees.tree_code", String.class);
    private static final Field<String> TREES_VARIETY = field("trees.variety", String.class);
    private static final Field<LocalDate> TREES_PLANTING_DATE = field("trees.planting_date", LocalDate.class);
    private static final Field<Integer> TREES_AGE = field("trees.age_years", Integer.class);
    private static final Field<BigDecimal> TREES_HEIGHT = field("trees.height_meters", BigDecimal.class);
    private static final Field<BigDecimal> TREES_DIAMETER = field("trees.trunk_diameter_cm", BigDecimal.class);
    private static final Field<String> TREES_HEALTH = field("trees.health_status", String.class);
    private static final Field<LocalDate> TREES_LAST_INSPECTION = field("trees.last_inspection", LocalDate.class);
    private static final Field<BigDecimal> TREES_MATURITY = field("trees.maturity_index", BigDecimal.class);
    private static final Field<BigDecimal> TREES_FUNGAL = field("trees.fungal_threat_level", BigDecimal.class);
    private static final Field<Integer> TREES_SECURITY_EVENTS = field("trees.security_events_count", Integer.class);
    private static final Field<Object> TREES_LOCATION = field("trees.location");

    private static final String LAT = "lat";
    private static final String LNG = "lng";

    // =========================================================================
    // Farms
    // =========================================================================

    /**
     * Farms with their coordinates, ordered by name.
     *
     * @param farmIds farms to return; null or empty returns every farm
     * @return farms with location
     */
    public List<Farm> findFarmsWithLocations(Collection<Long> farmIds) {
        Condition condition = farmIds == null || farmIds.isEmpty() ? noCondition() : FARMS_ID.in(farmIds);

        return dsl
            .select(farmFields())
            .from(FARMS)
            .where(condition)
            .orderBy(FARMS_NAME)
            .fetch()
            .map(PlantationJooqRepository::toFarm);
    }

    public Optional<Farm> findFarmBySlug(String slug) {
        return dsl
            .select(farmFields())
            .from(FARMS)
            .where(FARMS_SLUG.eq(slug))
            .fetchOptional()
            .map(PlantationJooqRepository::toFarm);
    }

    // =========================================================================
    // Lots
    // =========================================================================

    /**
     * Resolves a lot number within a farm to the lot's primary key.
     */
    public Optional<Long> findLotId(long farmId, int lotNumber) {
        return dsl
            .select(LOTS_ID)
            .from(LOTS)
            .where(LOTS_FARM_ID.eq(farmId))
            .and(LOTS_NUMBER.eq(lotNumber))
            .fetchOptional(LOTS_ID);
    }

    /**
     * Lots of a farm with their tree metrics, in one grouped query regardless of the
     * number of lots.
     *
     * Lots without trees are included with zero counts and averages
     * ({@link LotTreeMetrics#hasTrees()} is false for them).
     *
     * @param farmId farm primary key
     * @param lotNumbers lot numbers to restrict to; null or empty returns every lot
     * @return lot metrics ordered by lot number
     */
    public List<LotTreeMetrics> findLotsWithTreeMetrics(long farmId, Collection<Integer> lotNumbers) {
        ChildAggregateQuery.ChildAggregateQueryBuilder query = ChildAggregateQuery.builder()
            .parentTable("lots")
            .parentColumn("lot_number")
            .parentColumn("area_hectares")
            .parentColumn("tree_density")
            .parentColumn("soil_type")
            .parentColumn("elevation_meters")
            .parentColumn("planting_date")
            .parentColumn("last_harvest")
            .locationColumn("centroid")
            .scope("farm_id", farmId)
            .childTable("trees")
            .childForeignKey("lot_id")
            .aggregate(AggregateSpec.count("tree_count"))
            .aggregate(AggregateSpec.countMatching("health_status", HEALTHY_STATUSES, "healthy_trees"))
            .aggregate(AggregateSpec.countMatching("health_status", UNHEALTHY_STATUSES, "unhealthy_trees"))
            .aggregate(AggregateSpec.avg("maturity_index", "avg_maturity"))
            .aggregate(AggregateSpec.avg("height_meters", "avg_height"))
            .aggregate(AggregateSpec.avg("trunk_diameter_cm", "avg_diameter"))
            .aggregate(AggregateSpec.avg("fungal_threat_level", "avg_fungal_threat"))
            .aggregate(AggregateSpec.sum("security_events_count", "total_security_events"))
            .aggregate(AggregateSpec.max("last_inspection", "last_tree_inspection"))
            .orderBy("lot_number");

        if (lotNumbers != null && !lotNumbers.isEmpty()) {
            query.filter("lot_number", lotNumbers);
        }

        List<LotTreeMetrics> lots = new ArrayList<>();
        for (AggregatedEntityMetrics metrics : planner.fetch(query.build()).values()) {
            lots.add(toLotMetrics(metrics));
        }
        return lots;
    }

    // =========================================================================
    // Trees
    // =========================================================================

    /**
     * Trees of a lot with their coordinates, ordered by tree code.
     *
     * @param lotId lot primary key
     * @param treeCodes tree codes to restrict to; null or empty returns every tree
     * @param limit maximum number of rows, null for no limit
     * @return trees with location
     */
    public List<Tree> findTreesWithLocations(long lotId, Collection<String> treeCodes, Integer limit) {
        Condition condition = TREES_LOT_ID.eq(lotId);
        if (treeCodes != null && !treeCodes.isEmpty()) {
            condition = condition.and(TREES_CODE.in(treeCodes));
        }

        List<Field<?>> fields = List.of(
            TREES_ID, TREES_CODE, TREES_VARIETY, TREES_PLANTING_DATE, TREES_AGE,
            TREES_HEIGHT, TREES_DIAMETER, TREES_HEALTH, TREES_LAST_INSPECTION,
            TREES_MATURITY, TREES_FUNGAL, TREES_SECURITY_EVENTS,
            latitude(TREES_LOCATION), longitude(TREES_LOCATION)
        );

        SelectLimitStep<Record> select = dsl
            .select(fields)
            .from(TREES)
            .where(condition)
            .orderBy(TREES_CODE);

        return (limit != null ? select.limit(limit) : select)
            .fetch()
            .map(r -> new Tree(
                r.get(TREES_ID),
                r.get(TREES_CODE),
                r.get(TREES_VARIETY),
                r.get(TREES_PLANTING_DATE),
                r.get(TREES_AGE),
                r.get(TREES_HEIGHT),
                r.get(TREES_DIAMETER),
                r.get(TREES_HEALTH),
                r.get(TREES_LAST_INSPECTION),
                r.get(TREES_MATURITY),
                r.get(TREES_FUNGAL),
                intOrZero(r.get(TREES_SECURITY_EVENTS)),
                GeoPoint.of(r.get(LAT, Double.class), r.get(LNG, Double.class))
            ));
    }

    /**
     * Trees of a farm with at least {@code minEvents} security events, joined to their lot,
     * most affected first.
     *
     * @param farmId farm primary key
     * @param lotNumber optional lot number filter
     * @param minEvents minimum security events per tree
     * @param limit maximum number of rows, null for no limit
     * @return trees with security data and location
     */
    public List<SecurityTree> findSecurityTreesWithLocations(
            long farmId, Integer lotNumber, int minEvents, Integer limit) {

        Condition condition = TREES_FARM_ID.eq(farmId).and(TREES_SECURITY_EVENTS.ge(minEvents));
        if (lotNumber != null) {
            condition = condition.and(LOTS_NUMBER.eq(lotNumber));
        }

        List<Field<?>> fields = List.of(
            TREES_ID, TREES_CODE, TREES_SECURITY_EVENTS, TREES_LOT_ID,
            TREES_HEALTH, TREES_MATURITY, TREES_LAST_INSPECTION,
            LOTS_NUMBER, LOTS_AREA,
            latitude(TREES_LOCATION), longitude(TREES_LOCATION)
        );

        SelectLimitStep<Record> select = dsl
            .select(fields)
            .from(TREES)
            .join(LOTS).on(TREES_LOT_ID.eq(LOTS_ID))
            .where(condition)
            .orderBy(TREES_SECURITY_EVENTS.desc(), TREES_LAST_INSPECTION.desc());

        return (limit != null ? select.limit(limit) : select)
            .fetch()
            .map(r -> new SecurityTree(
                r.get(TREES_ID),
                r.get(TREES_CODE),
                intOrZero(r.get(TREES_SECURITY_EVENTS)),
                r.get(TREES_LOT_ID),
                r.get(LOTS_NUMBER),
                r.get(LOTS_AREA),
                r.get(TREES_HEALTH),
                r.get(TREES_MATURITY),
                r.get(TREES_LAST_INSPECTION),
                GeoPoint.of(r.get(LAT, Double.class), r.get(LNG, Double.class))
            ));
    }

    // =========================================================================
    // Analytics
    // =========================================================================

    /**
     * Farm-wide analytics in one query: farm LEFT JOIN lots LEFT JOIN trees, grouped by farm,
     * with the lot area taken from a scalar subquery over lots alone.
     *
     * A farm without lots or trees still yields one row with zero counts.
     *
     * @param farmId farm primary key
     * @return analytics, empty when the farm does not exist
     */
    public Optional<FarmAnalytics> findFarmAnalyticsSummary(long farmId) {
        Field<Integer> totalLots = countDistinct(LOTS_ID).as("total_lots");
        // Summed apart from the tree join, which repeats each lot once per tree
        Field<BigDecimal> totalLotArea = field(
            select(coalesce(sum(LOTS_AREA), inline(BigDecimal.ZERO))).from(LOTS).where(LOTS_FARM_ID.eq(farmId))
        ).as("total_lot_area");
        Field<Integer> totalTrees = count(TREES_ID).as("total_trees");
        Field<Integer> healthyTrees = count(when(TREES_HEALTH.in(HEALTHY_STATUSES), inline(1))).as("healthy_trees");
        Field<Integer> unhealthyTrees = count(when(TREES_HEALTH.in(UNHEALTHY_STATUSES), inline(1))).as("unhealthy_trees");
        Field<BigDecimal> avgMaturity = coalesce(avg(TREES_MATURITY), inline(BigDecimal.ZERO)).as("avg_maturity");
        Field<BigDecimal> avgHeight = coalesce(avg(TREES_HEIGHT), inline(BigDecimal.ZERO)).as("avg_height");
        Field<BigDecimal> avgFungal = coalesce(avg(TREES_FUNGAL), inline(BigDecimal.ZERO)).as("avg_fungal_threat");
        Field<BigDecimal> totalEvents = coalesce(sum(TREES_SECURITY_EVENTS), inline(BigDecimal.ZERO)).as("total_security_events");
        Field<LocalDate> lastInspection = max(TREES_LAST_INSPECTION).as("last_inspection");
        Field<LocalDate> oldestPlanting = min(TREES_PLANTING_DATE).as("oldest_planting");
        Field<LocalDate> newestPlanting = max(TREES_PLANTING_DATE).as("newest_planting");

        return dsl
            .select(
                FARMS_NAME, FARMS_SLUG, FARMS_AREA,
                totalLots, totalLotArea, totalTrees, healthyTrees, unhealthyTrees,
                avgMaturity, avgHeight, avgFungal, totalEvents,
                lastInspection, oldestPlanting, newestPlanting
            )
            .from(FARMS)
            .leftJoin(LOTS).on(LOTS_FARM_ID.eq(FARMS_ID))
            .leftJoin(TREES).on(TREES_LOT_ID.eq(LOTS_ID))
            .where(FARMS_ID.eq(farmId))
            .groupBy(FARMS_ID, FARMS_NAME, FARMS_SLUG, FARMS_AREA)
            .fetchOptional()
            .map(r -> new FarmAnalytics(
                r.get(FARMS_NAME),
                r.get(FARMS_SLUG),
                r.get(FARMS_AREA),
                longOrZero(r.get(totalLots)),
                r.get(totalLotArea) == null ? BigDecimal.ZERO : r.get(totalLotArea),
                longOrZero(r.get(totalTrees)),
                longOrZero(r.get(healthyTrees)),
                longOrZero(r.get(unhealthyTrees)),
                doubleOrZero(r.get(avgMaturity)),
                doubleOrZero(r.get(avgHeight)),
                doubleOrZero(r.get(avgFungal)),
                longOrZero(r.get(totalEvents)),
                r.get(lastInspection),
                r.get(oldestPlanting),
                r.get(newestPlanting)
            ));
    }

    // =========================================================================
    // Mapping
    // =========================================================================

    private static List<Field<?>> farmFields() {
        return List.of(
            FARMS_ID, FARMS_NAME, FARMS_SLUG, FARMS_AREA, FARMS_ESTABLISHED,
            FARMS_EMAIL, FARMS_PHONE, latitude(FARMS_LOCATION), longitude(FARMS_LOCATION)
        );
    }

    private static Farm toFarm(Record r) {
        return new Farm(
            r.get(FARMS_ID),
            r.get(FARMS_NAME),
            r.get(FARMS_SLUG),
            r.get(FARMS_AREA),
            r.get(FARMS_ESTABLISHED),
            r.get(FARMS_EMAIL),
            r.get(FARMS_PHONE),
            GeoPoint.of(r.get(LAT, Double.class), r.get(LNG, Double.class))
        );
    }

    private static LotTreeMetrics toLotMetrics(AggregatedEntityMetrics m) {
        return new LotTreeMetrics(
            m.id(),
            ((Number) m.column("lot_number")).intValue(),
            decimal(m.column("area_hectares")),
            integer(m.column("tree_density")),
            (String) m.column("soil_type"),
            integer(m.column("elevation_meters")),
            localDate(m.column("planting_date")),
            localDate(m.column("last_harvest")),
            m.location(),
            m.count("tree_count"),
            m.count("healthy_trees"),
            m.count("unhealthy_trees"),
            m.average("avg_maturity"),
            m.average("avg_height"),
            m.average("avg_diameter"),
            m.average("avg_fungal_threat"),
            (long) m.sum("total_security_events"),
            localDate(m.max("last_tree_inspection")),
            m.hasChildren()
        );
    }

    private static Field<Double> latitude(Field<Object> geography) {
        return field("ST_Y(CAST({0} AS geometry))", Double.class, geography).as(LAT);
    }

    private static Field<Double> longitude(Field<Object> geography) {
        return field("ST_X(CAST({0} AS geometry))", Double.class, geography).as(LNG);
    }

    private static BigDecimal decimal(Object value) {
        if (value == null || value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }

    private static Integer integer(Object value) {
        return value == null ? null : ((Number) value).intValue();
    }

    static LocalDate localDate(Object value) {
        if (value == null || value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        return LocalDate.parse(value.toString());
    }

    private static int intOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static long longOrZero(Number value) {
        return value == null ? 0L : value.longValue();
    }

    private static double doubleOrZero(Number value) {
        return value == null ? 0.0 : value.doubleValue();
    }
}
