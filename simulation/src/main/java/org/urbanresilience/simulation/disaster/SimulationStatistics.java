package org.urbanresilience.simulation.disaster;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate figures of one disaster run.
 */
public final class SimulationStatistics {

    private final int treesEvaluated;
    private final int treesAffected;
    private final int roadsAffected;
    private final double totalBlockedLength;
    private final Map<VulnerabilityLevel, Integer> treesByLevel;
    private final double averageBlockagePercentage;

    private SimulationStatistics(int treesEvaluated, int treesAffected, int roadsAffected, double totalBlockedLength,
                                 Map<VulnerabilityLevel, Integer> treesByLevel, double averageBlockagePercentage) {
        this.treesEvaluated = treesEvaluated;
        this.treesAffected = treesAffected;
        this.roadsAffected = roadsAffected;
        this.totalBlockedLength = totalBlockedLength;
        this.treesByLevel = Collections.unmodifiableMap(treesByLevel);
        this.averageBlockagePercentage = averageBlockagePercentage;
    }

    public static SimulationStatistics of(int treesEvaluated, Collection<TreeCollapseEvent> events,
                                          Collection<RoadObstruction> obstructions) {
        Map<VulnerabilityLevel, Integer> byLevel = new EnumMap<>(VulnerabilityLevel.class);
        for (VulnerabilityLevel level : VulnerabilityLevel.values()) {
            byLevel.put(level, 0);
        }
        for (TreeCollapseEvent event : events) {
            byLevel.merge(event.getLevel(), 1, Integer::sum);
        }

        Set<Integer> roads = new HashSet<>();
        double blockedLength = 0.0;
        double percentageSum = 0.0;
        for (RoadObstruction obstruction : obstructions) {
            roads.add(obstruction.getEdgeId());
            blockedLength += obstruction.getBlockedLength();
            percentageSum += obstruction.getBlockedPercentage();
        }
        double average = obstructions.isEmpty() ? 0.0 : percentageSum / obstructions.size();
        return new SimulationStatistics(treesEvaluated, events.size(), roads.size(), blockedLength, byLevel, average);
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

    public double getTotalBlockedLength() {
        return totalBlockedLength;
    }

    public Map<VulnerabilityLevel, Integer> getTreesByLevel() {
        return treesByLevel;
    }

    public double getAverageBlockagePercentage() {
        return averageBlockagePercentage;
    }

    @Override
    public String toString() {
        return "SimulationStatistics{" +
                "treesAffected=" + treesAffected + "/" + treesEvaluated +
                ", roadsAffected=" + roadsAffected +
                ", totalBlockedLength=" + String.format("%.1f", totalBlockedLength) +
                ", byLevel=" + treesByLevel +
                ", averageBlockage=" + String.format("%.1f%%", averageBlockagePercentage) +
                '}';
    }
}
