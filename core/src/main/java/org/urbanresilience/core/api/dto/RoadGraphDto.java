package org.urbanresilience.core.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.urbanresilience.core.model.LaneInfo;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON view of a road graph with per-edge geometry, as handed to the orchestration layer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RoadGraphDto {

    @JsonProperty("boundary")
    private BoundaryDto boundary;

    @JsonProperty("nodes")
    private List<NodeDto> nodes = new ArrayList<>();

    @JsonProperty("edges")
    private List<EdgeDto> edges = new ArrayList<>();

    public static RoadGraphDto from(RoadGraph graph, MapBoundary boundary) {
        RoadGraphDto dto = new RoadGraphDto();
        dto.boundary = BoundaryDto.from(boundary);
        for (RoadNode node : graph.nodes()) {
            dto.nodes.add(NodeDto.from(node));
        }
        for (RoadEdge edge : graph.edges()) {
            dto.edges.add(EdgeDto.from(edge, graph.node(edge.getFromNode()), graph.node(edge.getToNode())));
        }
        return dto;
    }

    public BoundaryDto getBoundary() {
        return boundary;
    }

    public List<NodeDto> getNodes() {
        return nodes;
    }

    public List<EdgeDto> getEdges() {
        return edges;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BoundaryDto {
        @JsonProperty("min_x")
        private double minX;
        @JsonProperty("min_y")
        private double minY;
        @JsonProperty("max_x")
        private double maxX;
        @JsonProperty("max_y")
        private double maxY;

        static BoundaryDto from(MapBoundary boundary) {
            BoundaryDto dto = new BoundaryDto();
            dto.minX = boundary.getMinX();
            dto.minY = boundary.getMinY();
            dto.maxX = boundary.getMaxX();
            dto.maxY = boundary.getMaxY();
            return dto;
        }

        public double getMinX() {
            return minX;
        }

        public double getMinY() {
            return minY;
        }

        public double getMaxX() {
            return maxX;
        }

        public double getMaxY() {
            return maxY;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDto {
        @JsonProperty("id")
        private int id;
        @JsonProperty("x")
        private double x;
        @JsonProperty("y")
        private double y;
        @JsonProperty("kind")
        private String kind;

        static NodeDto from(RoadNode node) {
            NodeDto dto = new NodeDto();
            dto.id = node.getId();
            dto.x = node.getX();
            dto.y = node.getY();
            dto.kind = node.getKind().name().toLowerCase();
            return dto;
        }

        public int getId() {
            return id;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public String getKind() {
            return kind;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDto {
        @JsonProperty("id")
        private int id;
        @JsonProperty("from")
        private int from;
        @JsonProperty("to")
        private int to;
        @JsonProperty("geometry")
        private List<double[]> geometry = new ArrayList<>();
        @JsonProperty("length")
        private double length;
        @JsonProperty("original_width")
        private double originalWidth;
        @JsonProperty("current_width")
        private double currentWidth;
        @JsonProperty("lanes")
        private int lanes;
        @JsonProperty("is_bidirectional")
        private boolean bidirectional;
        @JsonProperty("road_type")
        private String roadType;
        @JsonProperty("speed_limit")
        private double speedLimit;
        @JsonProperty("primary_direction")
        private String primaryDirection;
        @JsonProperty("has_center_divider")
        private boolean centerDivider;
        @JsonProperty("lane_info")
        private List<LaneDto> laneInfo = new ArrayList<>();

        static EdgeDto from(RoadEdge edge, RoadNode from, RoadNode to) {
            EdgeDto dto = new EdgeDto();
            dto.id = edge.getId();
            dto.from = edge.getFromNode();
            dto.to = edge.getToNode();
            dto.geometry.add(new double[] {from.getX(), from.getY()});
            dto.geometry.add(new double[] {to.getX(), to.getY()});
            dto.length = edge.getLength();
            dto.originalWidth = edge.getOriginalWidth();
            dto.currentWidth = edge.getCurrentWidth();
            dto.lanes = edge.getLanes();
            dto.bidirectional = edge.isBidirectional();
            dto.roadType = edge.getRoadClass().name().toLowerCase();
            dto.speedLimit = edge.getSpeedLimitKmh();
            dto.primaryDirection = edge.getPrimaryDirection().name().toLowerCase();
            dto.centerDivider = edge.hasCenterDivider();
            for (LaneInfo lane : edge.getLaneInfo()) {
                dto.laneInfo.add(LaneDto.from(lane));
            }
            return dto;
        }

        public int getId() {
            return id;
        }

        public int getFrom() {
            return from;
        }

        public int getTo() {
            return to;
        }

        public List<double[]> getGeometry() {
            return geometry;
        }

        public double getLength() {
            return length;
        }

        public double getOriginalWidth() {
            return originalWidth;
        }

        public double getCurrentWidth() {
            return currentWidth;
        }

        public int getLanes() {
            return lanes;
        }

        public boolean isBidirectional() {
            return bidirectional;
        }

        public String getRoadType() {
            return roadType;
        }

        public double getSpeedLimit() {
            return speedLimit;
        }

        public String getPrimaryDirection() {
            return primaryDirection;
        }

        public boolean isCenterDivider() {
            return centerDivider;
        }

        public List<LaneDto> getLaneInfo() {
            return laneInfo;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class LaneDto {
        @JsonProperty("lane_id")
        private int laneId;
        @JsonProperty("direction")
        private String direction;
        @JsonProperty("side")
        private String side;
        @JsonProperty("width")
        private double width;

        static LaneDto from(LaneInfo lane) {
            LaneDto dto = new LaneDto();
            dto.laneId = lane.getIndex();
            dto.direction = lane.getDirection().name().toLowerCase();
            dto.side = lane.getSide().name().toLowerCase();
            dto.width = lane.getWidth();
            return dto;
        }

        public int getLaneId() {
            return laneId;
        }

        public String getDirection() {
            return direction;
        }

        public String getSide() {
            return side;
        }

        public double getWidth() {
            return width;
        }
    }
}
