package org.urbanresilience.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.analysis.config.SimulatorConfig;
import org.urbanresilience.analysis.domain.model.AnalysisMode;
import org.urbanresilience.analysis.domain.model.CoverageResult;
import org.urbanresilience.analysis.domain.service.CoverageService;
import org.urbanresilience.analysis.domain.service.CoverageServiceImpl;
import org.urbanresilience.analysis.report.SimulationReport;
import org.urbanresilience.core.api.dto.RoadGraphDto;
import org.urbanresilience.simulation.disaster.DisasterSimulationResult;
import org.urbanresilience.simulation.disaster.DisasterSimulator;
import org.urbanresilience.simulation.disaster.RoadObstruction;
import org.urbanresilience.simulation.disaster.TreeCollapseSimulator;
import org.urbanresilience.simulation.disaster.TreePlacementReader;
import org.urbanresilience.simulation.disaster.TreeRecord;
import org.urbanresilience.simulation.network.ConnectivityReport;
import org.urbanresilience.simulation.network.NetworkAnalyzer;
import org.urbanresilience.simulation.network.VehicleType;
import org.urbanresilience.synthesizer.generator.MapSynthesizer;
import org.urbanresilience.synthesizer.generator.ProceduralMapSynthesizer;
import org.urbanresilience.synthesizer.generator.SynthesizedMap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Command line entry point: synthesizes a city, drops trees on it, and reports what is left of the
 * road network.
 *
 * Steps:
 * - synthesize the map from MAP_WIDTH, MAP_HEIGHT and MAIN_ROAD_COUNT
 * - if TREES_FILE is set, simulate the storm and apply the obstructions
 * - analyze connectivity for ambulances and fire trucks
 * - if STATION_POINTS is set, compare coverage before and after the storm
 * - write the JSON report to REPORT_FILE
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            new Main().run(SimulatorConfig.fromEnvironment());
        } catch (Exception e) {
            LOG.error("Simulation run failed", e);
            System.exit(1);
        }
    }

    SimulationReport run(SimulatorConfig config) throws IOException {
        LOG.info("=== Urban Resilience Simulator ===");
        LOG.info("Configuration: {}", config);

        MapSynthesizer synthesizer = new ProceduralMapSynthesizer(config.getSynthesizer());
        SynthesizedMap world = synthesizer.synthesize();
        LOG.info("Synthesized {}", world);
        SimulationReport report = new SimulationReport(Instant.now().toString(), world);

        List<RoadObstruction> obstructions = Collections.emptyList();
        if (config.getTreesFile().isPresent()) {
            Path treesFile = config.getTreesFile().get();
            List<TreeRecord> trees = new TreePlacementReader().read(treesFile);
            LOG.info("Loaded {} trees from {}", trees.size(), treesFile);
            DisasterSimulator simulator = new TreeCollapseSimulator(config.getDisaster());
            DisasterSimulationResult disaster = simulator.simulate(trees, world.getGraph());
            obstructions = disaster.getObstructions();
            report.withDisaster(disaster);
        } else {
            LOG.info("No TREES_FILE configured, analyzing the intact network");
        }

        NetworkAnalyzer analyzer = new NetworkAnalyzer(world.getGraph(), config.getAnalyzer());
        analyzer.applyObstructions(obstructions);
        for (VehicleType type : new VehicleType[] {VehicleType.AMBULANCE, VehicleType.FIRE_TRUCK}) {
            ConnectivityReport connectivity = analyzer.analyzeConnectivity(type.defaultProfile());
            LOG.info("Connectivity: {}", connectivity);
            report.addConnectivity(connectivity);
        }

        if (config.getStations().isEmpty()) {
            LOG.info("No STATION_POINTS configured, skipping coverage analysis");
        } else {
            CoverageService coverage = new CoverageServiceImpl(config.getCoverage());
            CoverageResult result = coverage.analyze(analyzer, world.getBoundary(), config.getStations(),
                    AnalysisMode.COMPARISON, obstructions);
            report.withCoverage(result);
        }

        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        write(mapper, config.getReportFile(), report);
        LOG.info("Report written to {}", config.getReportFile().toAbsolutePath());
        if (config.getNetworkFile().isPresent()) {
            Path networkFile = config.getNetworkFile().get();
            write(mapper, networkFile, RoadGraphDto.from(world.getGraph(), world.getBoundary()));
            LOG.info("Road network written to {}", networkFile.toAbsolutePath());
        }
        LOG.info("=== Simulation complete ===");
        return report;
    }

    private static void write(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), value);
    }
}
