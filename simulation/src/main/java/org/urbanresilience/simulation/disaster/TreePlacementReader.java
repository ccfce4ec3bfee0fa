package org.urbanresilience.simulation.disaster;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.api.dto.TreePlacementDto;
import org.urbanresilience.core.api.dto.TreePlacementDto.TreeDto;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads tree inventories from JSON.
 * <p>
 * Accepts either {@code {"trees": [{"id": ..., ...}]}} or an object keyed by tree id,
 * optionally wrapped in {@code "trees"}.
 */
public final class TreePlacementReader {

    private static final Logger log = LoggerFactory.getLogger(TreePlacementReader.class);

    private final ObjectMapper objectMapper;

    public TreePlacementReader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<TreeRecord> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            List<TreeRecord> trees = read(in);
            log.info("[Trees] Loaded {} trees from {}", trees.size(), file);
            return trees;
        }
    }

    /**
     * @throws IllegalArgumentException if a tree lacks a level, location or positive dimensions
     */
    public List<TreeRecord> read(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new IOException("Tree placement input is empty");
        }
        JsonNode trees = root.has("trees") ? root.get("trees") : root;
        List<TreeDto> dtos;
        if (trees.isArray()) {
            dtos = objectMapper.convertValue(root.has("trees") ? root : wrap(trees), TreePlacementDto.class).getTrees();
        } else if (trees.isObject()) {
            dtos = keyedById(trees);
        } else {
            throw new IOException("Unsupported tree placement layout: " + trees.getNodeType());
        }

        List<TreeRecord> records = new ArrayList<>(dtos.size());
        for (TreeDto dto : dtos) {
            records.add(toRecord(dto, records.size()));
        }
        return records;
    }

    private JsonNode wrap(JsonNode array) {
        return objectMapper.createObjectNode().set("trees", array);
    }

    private List<TreeDto> keyedById(JsonNode trees) {
        Map<String, TreeDto> byId = objectMapper.convertValue(trees, new TypeReference<Map<String, TreeDto>>() {
        });
        List<TreeDto> dtos = new ArrayList<>(byId.size());
        for (Map.Entry<String, TreeDto> entry : byId.entrySet()) {
            TreeDto dto = entry.getValue();
            if (dto.getId() == null) {
                dto.setId(entry.getKey());
            }
            dtos.add(dto);
        }
        return dtos;
    }

    static TreeRecord toRecord(TreeDto dto, int position) {
        String id = dto.getId() != null ? dto.getId() : "tree-" + position;
        if (dto.getX() == null || dto.getY() == null) {
            throw new IllegalArgumentException("tree " + id + " has no location");
        }
        if (dto.getHeight() == null || dto.getTrunkWidth() == null) {
            throw new IllegalArgumentException("tree " + id + " is missing height or trunk_width");
        }
        return new TreeRecord(id, dto.getX(), dto.getY(), VulnerabilityLevel.fromCode(dto.getVulnerabilityLevel()),
                dto.getHeight(), dto.getTrunkWidth());
    }
}
