package org.urbanresilience.simulation.network;

/**
 * How much of the network a vehicle class can still use.
 */
public final class ConnectivityReport {

    private final VehicleType vehicleType;
    private final int totalEdges;
    private final int passableEdges;
    private final double totalLength;
    private final double passableLength;
    private final int severelyObstructedEdges;
    private final int componentCount;
    private final int largestComponentSize;

    ConnectivityReport(VehicleType vehicleType, int totalEdges, int passableEdges, double totalLength,
                       double passableLength, int severelyObstructedEdges, int componentCount,
                       int largestComponentSize) {
        this.vehicleType = vehicleType;
        this.totalEdges = totalEdges;
        this.passableEdges = passableEdges;
        this.totalLength = totalLength;
        this.passableLength = passableLength;
        this.severelyObstructedEdges = severelyObstructedEdges;
        this.componentCount = componentCount;
        this.largestComponentSize = largestComponentSize;
    }

    public VehicleType getVehicleType() {
        return vehicleType;
    }

    public int getTotalEdges() {
        return totalEdges;
    }

    public int getPassableEdges() {
        return passableEdges;
    }

    public int getBlockedEdges() {
        return totalEdges - passableEdges;
    }

    public double getTotalLength() {
        return totalLength;
    }

    public double getPassableLength() {
        return passableLength;
    }

    public double getBlockedLength() {
        return totalLength - passableLength;
    }

    /** Edges narrowed below half their original width. */
    public int getSeverelyObstructedEdges() {
        return severelyObstructedEdges;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public int getLargestComponentSize() {
        return largestComponentSize;
    }

    public double getConnectivityRatio() {
        return totalEdges == 0 ? 1.0 : (double) passableEdges / totalEdges;
    }

    public boolean isFragmented() {
        return componentCount > 1;
    }

    @Override
    public String toString() {
        return "ConnectivityReport{" +
                "vehicle=" + vehicleType +
                ", passable=" + passableEdges + "/" + totalEdges +
                ", components=" + componentCount +
                ", largest=" + largestComponentSize +
                ", ratio=" + String.format("%.3f", getConnectivityRatio()) +
                '}';
    }
}
