package org.urbanresilience.analysis.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.urbanresilience.analysis.domain.model.ComparisonClass;
import org.urbanresilience.analysis.domain.model.ComparisonMetrics;
import org.urbanresilience.analysis.domain.model.CoverageMetrics;
import org.urbanresilience.analysis.domain.model.CoverageResult;
import org.urbanresilience.analysis.domain.model.ServiceLevel;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.simulation.disaster.DisasterSimulationResult;
import org.urbanresilience.simulation.disaster.SimulationStatistics;
import org.urbanresilience.simulation.disaster.VulnerabilityLevel;
import org.urbanresilience.simulation.network.ConnectivityReport;
import org.urbanresilience.synthesizer.generator.SynthesizedMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON summary of one simulator run: the map, the disaster, network connectivity and coverage.
 * Sections that were not computed are left out.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SimulationReport {

    @JsonProperty("generated_at")
    private String generatedAt;

    @JsonProperty("map")
    private MapSection map;

    @JsonProperty("disaster")
    private DisasterSection disaster;

    @JsonProperty("connectivity")
    private List<ConnectivitySection> connectivity = new ArrayList<>();

    @JsonProperty("coverage")
    private CoverageSection coverage;

    public SimulationReport() {
    }

    public SimulationReport(String generatedAt, SynthesizedMap world) {
        this.generatedAt = generatedAt;
        this.map = MapSection.from(world);
    }

    public SimulationReport withDisaster(DisasterSimulationResult result) {
        this.disaster = DisasterSection.from(result);
        return this;
    }

    public SimulationReport addConnectivity(ConnectivityReport report) {
        this.connectivity.add(ConnectivitySection.from(report));
        return this;
    }

    public SimulationReport withCoverage(CoverageResult result) {
        this.coverage = CoverageSection.from(result);
        return this;
    }

    public String getGeneratedAt() {
        return generatedAt;
    }

    public MapSection getMap() {
        return map;
    }

    public DisasterSection getDisaster() {
        return disaster;
    }

    public List<ConnectivitySection> getConnectivity() {
        return connectivity;
    }

    public CoverageSection getCoverage() {
        return coverage;
    }

    private static String key(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MapSection {
        @JsonProperty("width")
        private double width;
        @JsonProperty("height")
        private double height;
        @JsonProperty("node_count")
        private int nodeCount;
        @JsonProperty("edge_count")
        private int edgeCount;
        @JsonProperty("total_road_length")
        private double totalRoadLength;
        @JsonProperty("edges_by_class")
        private Map<String, Integer> edgesByClass = new TreeMap<>();

        static MapSection from(SynthesizedMap world) {
            MapSection section = new MapSection();
            section.width = world.getBoundary().width();
            section.height = world.getBoundary().height();
            section.nodeCount = world.getNodeCount();
            section.edgeCount = world.getEdgeCount();
            section.totalRoadLength = world.getTotalRoadLength();
            for (Map.Entry<RoadClass, Integer> entry : world.getEdgeCountsByClass().entrySet()) {
                section.edgesByClass.put(key(entry.getKey()), entry.getValue());
            }
            return section;
        }

        public double getWidth() {
            return width;
        }

        public double getHeight() {
            return height;
        }

        public int getNodeCount() {
            return nodeCount;
        }

        public int getEdgeCount() {
            return edgeCount;
        }

        public double getTotalRoadLength() {
            return totalRoadLength;
        }

        public Map<String, Integer> getEdgesByClass() {
            return edgesByClass;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DisasterSection {
        @JsonProperty("simulation_id")
        private String simulationId;
        @JsonProperty("intensity")
        private double intensity;
        @JsonProperty("trees_evaluated")
        private int treesEvaluated;
        @JsonProperty("trees_affected")
        private int treesAffected;
        @JsonProperty("roads_affected")
        private int roadsAffected;
        @JsonProperty("obstructions")
        private int obstructions;
        @JsonProperty("total_blocked_length")
        private double totalBlockedLength;
        @JsonProperty("average_blockage_percentage")
        private double averageBlockagePercentage;
        @JsonProperty("trees_by_level")
        private Map<String, Integer> treesByLevel = new TreeMap<>();

        static DisasterSection from(DisasterSimulationResult result) {
            SimulationStatistics stats = result.getStatistics();
            DisasterSection section = new DisasterSection();
            section.simulationId = result.getSimulationId();
            section.intensity = result.getConfig().getIntensity();
            section.treesEvaluated = stats.getTreesEvaluated();
            section.treesAffected = stats.getTreesAffected();
            section.roadsAffected = stats.getRoadsAffected();
            section.obstructions = result.getObstructions().size();
            section.totalBlockedLength = stats.getTotalBlockedLength();
            section.averageBlockagePercentage = stats.getAverageBlockagePercentage();
            for (Map.Entry<VulnerabilityLevel, Integer> entry : stats.getTreesByLevel().entrySet()) {
                section.treesByLevel.put(entry.getKey().name(), entry.getValue());
            }
            return section;
        }

        public String getSimulationId() {
            return simulationId;
        }

        public double getIntensity() {
            return intensity;
        }

        public int getTreesEvaluated() {
            return treesEvaluated;
        }

        public int getTreesAffected() {
            return treesAffected;
        }

        public int getRoadsAffected() {
            return roadsAffected;
        }

        public int getObstructions() {
            return obstructions;
        }

        public double getTotalBlockedLength() {
            return totalBlockedLength;
        }

        public double getAverageBlockagePercentage() {
            return averageBlockagePercentage;
        }

        public Map<String, Integer> getTreesByLevel() {
            return treesByLevel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectivitySection {
        @JsonProperty("vehicle_type")
        private String vehicleType;
        @JsonProperty("total_edges")
        private int totalEdges;
        @JsonProperty("blocked_edges")
        private int blockedEdges;
        @JsonProperty("severely_obstructed_edges")
        private int severelyObstructedEdges;
        @JsonProperty("blocked_length")
        private double blockedLength;
        @JsonProperty("component_count")
        private int componentCount;
        @JsonProperty("largest_component_size")
        private int largestComponentSize;
        @JsonProperty("connectivity_ratio")
        private double connectivityRatio;
        @JsonProperty("fragmented")
        private boolean fragmented;

        static ConnectivitySection from(ConnectivityReport report) {
            ConnectivitySection section = new ConnectivitySection();
            section.vehicleType = key(report.getVehicleType());
            section.totalEdges = report.getTotalEdges();
            section.blockedEdges = report.getBlockedEdges();
            section.severelyObstructedEdges = report.getSeverelyObstructedEdges();
            section.blockedLength = report.getBlockedLength();
            section.componentCount = report.getComponentCount();
            section.largestComponentSize = report.getLargestComponentSize();
            section.connectivityRatio = report.getConnectivityRatio();
            section.fragmented = report.isFragmented();
            return section;
        }

        public String getVehicleType() {
            return vehicleType;
        }

        public int getTotalEdges() {
            return totalEdges;
        }

        public int getBlockedEdges() {
            return blockedEdges;
        }

        public int getSeverelyObstructedEdges() {
            return severelyObstructedEdges;
        }

        public double getBlockedLength() {
            return blockedLength;
        }

        public int getComponentCount() {
            return componentCount;
        }

        public int getLargestComponentSize() {
            return largestComponentSize;
        }

        public double getConnectivityRatio() {
            return connectivityRatio;
        }

        public boolean isFragmented() {
            return fragmented;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CoverageSection {
        @JsonProperty("mode")
        private String mode;
        @JsonProperty("pre_disaster")
        private MetricsSection preDisaster;
        @JsonProperty("post_disaster")
        private MetricsSection postDisaster;
        @JsonProperty("comparison")
        private ComparisonSection comparison;

        static CoverageSection from(CoverageResult result) {
            CoverageSection section = new CoverageSection();
            section.mode = key(result.getMode());
            section.preDisaster = result.getPreDisasterMetrics().map(MetricsSection::from).orElse(null);
            section.postDisaster = result.getPostDisasterMetrics().map(MetricsSection::from).orElse(null);
            section.comparison = result.getComparisonMetrics().map(ComparisonSection::from).orElse(null);
            return section;
        }

        public String getMode() {
            return mode;
        }

        public MetricsSection getPreDisaster() {
            return preDisaster;
        }

        public MetricsSection getPostDisaster() {
            return postDisaster;
        }

        public ComparisonSection getComparison() {
            return comparison;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class MetricsSection {
        @JsonProperty("total_cells")
        private int totalCells;
        @JsonProperty("reachable_cells")
        private int reachableCells;
        @JsonProperty("unreachable_cells")
        private int unreachableCells;
        @JsonProperty("coverage_percentage")
        private double coveragePercentage;
        @JsonProperty("average_response_time")
        private double averageResponseTime;
        @JsonProperty("median_response_time")
        private double medianResponseTime;
        @JsonProperty("max_response_time")
        private double maxResponseTime;
        @JsonProperty("blind_area_m2")
        private double blindArea;
        @JsonProperty("total_area_m2")
        private double totalArea;
        @JsonProperty("stations_analyzed")
        private int stationsAnalyzed;
        @JsonProperty("cells_by_level")
        private Map<String, Integer> cellsByLevel = new TreeMap<>();

        static MetricsSection from(CoverageMetrics metrics) {
            MetricsSection section = new MetricsSection();
            section.totalCells = metrics.getTotalCells();
            section.reachableCells = metrics.getReachableCells();
            section.unreachableCells = metrics.getUnreachableCells();
            section.coveragePercentage = metrics.getCoveragePercentage();
            section.averageResponseTime = metrics.getAverageResponseTime();
            section.medianResponseTime = metrics.getMedianResponseTime();
            section.maxResponseTime = metrics.getMaxResponseTime();
            section.blindArea = metrics.getBlindAreaSquareMeters();
            section.totalArea = metrics.getTotalAreaSquareMeters();
            section.stationsAnalyzed = metrics.getStationsAnalyzed();
            for (Map.Entry<ServiceLevel, Integer> entry : metrics.getCellsByLevel().entrySet()) {
                section.cellsByLevel.put(key(entry.getKey()), entry.getValue());
            }
            return section;
        }

        public int getTotalCells() {
            return totalCells;
        }

        public int getReachableCells() {
            return reachableCells;
        }

        public int getUnreachableCells() {
            return unreachableCells;
        }

        public double getCoveragePercentage() {
            return coveragePercentage;
        }

        public double getAverageResponseTime() {
            return averageResponseTime;
        }

        public double getMedianResponseTime() {
            return medianResponseTime;
        }

        public double getMaxResponseTime() {
            return maxResponseTime;
        }

        public double getBlindArea() {
            return blindArea;
        }

        public double getTotalArea() {
            return totalArea;
        }

        public int getStationsAnalyzed() {
            return stationsAnalyzed;
        }

        public Map<String, Integer> getCellsByLevel() {
            return cellsByLevel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ComparisonSection {
        @JsonProperty("coverage_change")
        private double coverageChange;
        @JsonProperty("newly_unreachable")
        private int newlyUnreachable;
        @JsonProperty("newly_reachable")
        private int newlyReachable;
        @JsonProperty("average_time_increase")
        private double averageTimeIncrease;
        @JsonProperty("median_time_increase")
        private double medianTimeIncrease;
        @JsonProperty("degraded_cells")
        private int degradedCells;
        @JsonProperty("improved_or_same_cells")
        private int improvedOrSameCells;
        @JsonProperty("cells_by_class")
        private Map<String, Integer> cellsByClass = new TreeMap<>();

        static ComparisonSection from(ComparisonMetrics metrics) {
            ComparisonSection section = new ComparisonSection();
            section.coverageChange = metrics.getCoverageChange();
            section.newlyUnreachable = metrics.getNewlyUnreachable();
            section.newlyReachable = metrics.getNewlyReachable();
            section.averageTimeIncrease = metrics.getAverageTimeIncrease();
            section.medianTimeIncrease = metrics.getMedianTimeIncrease();
            section.degradedCells = metrics.getDegradedCells();
            section.improvedOrSameCells = metrics.getImprovedOrSameCells();
            for (Map.Entry<ComparisonClass, Integer> entry : metrics.getCellsByClass().entrySet()) {
                section.cellsByClass.put(key(entry.getKey()), entry.getValue());
            }
            return section;
        }

        public double getCoverageChange() {
            return coverageChange;
        }

        public int getNewlyUnreachable() {
            return newlyUnreachable;
        }

        public int getNewlyReachable() {
            return newlyReachable;
        }

        public double getAverageTimeIncrease() {
            return averageTimeIncrease;
        }

        public double getMedianTimeIncrease() {
            return medianTimeIncrease;
        }

        public int getDegradedCells() {
            return degradedCells;
        }

        public int getImprovedOrSameCells() {
            return improvedOrSameCells;
        }

        public Map<String, Integer> getCellsByClass() {
            return cellsByClass;
        }
    }
}
