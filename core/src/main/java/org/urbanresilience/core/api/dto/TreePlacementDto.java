package org.urbanresilience.core.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree inventory handed to the disaster simulation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TreePlacementDto {

    @JsonProperty("trees")
    private List<TreeDto> trees = new ArrayList<>();

    public List<TreeDto> getTrees() {
        return trees;
    }

    public void setTrees(List<TreeDto> trees) {
        this.trees = trees;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TreeDto {

        @JsonProperty("id")
        private String id;

        @JsonProperty("x")
        private Double x;

        @JsonProperty("y")
        private Double y;

        @JsonProperty("vulnerability_level")
        private String vulnerabilityLevel;

        @JsonProperty("height")
        private Double height;

        @JsonProperty("trunk_width")
        private Double trunkWidth;

        public TreeDto() {
        }

        public TreeDto(String id, double x, double y, String vulnerabilityLevel, double height, double trunkWidth) {
            this.id = id;
            this.x = x;
            this.y = y;
            this.vulnerabilityLevel = vulnerabilityLevel;
            this.height = height;
            this.trunkWidth = trunkWidth;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Double getX() {
            return x;
        }

        public Double getY() {
            return y;
        }

        public String getVulnerabilityLevel() {
            return vulnerabilityLevel;
        }

        public Double getHeight() {
            return height;
        }

        public Double getTrunkWidth() {
            return trunkWidth;
        }
    }
}
