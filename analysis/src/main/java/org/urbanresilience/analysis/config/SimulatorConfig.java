package org.urbanresilience.analysis.config;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.config.EnvironmentReader;
import org.urbanresilience.simulation.config.AnalyzerConfig;
import org.urbanresilience.simulation.config.DisasterConfig;
import org.urbanresilience.synthesizer.config.SynthesizerConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a full synthesize, storm and analyze run.
 */
public final class SimulatorConfig {

    public static final String DEFAULT_REPORT_FILE = "simulation-report.json";

    private final SynthesizerConfig synthesizer;
    private final DisasterConfig disaster;
    private final AnalyzerConfig analyzer;
    private final CoverageConfig coverage;
    private final Path treesFile;
    private final List<Coordinate> stations;
    private final Path reportFile;
    private final Path networkFile;

    private SimulatorConfig(Builder builder) {
        this.synthesizer = builder.synthesizer;
        this.disaster = builder.disaster;
        this.analyzer = builder.analyzer;
        this.coverage = builder.coverage;
        this.treesFile = builder.treesFile;
        this.stations = Collections.unmodifiableList(new ArrayList<>(builder.stations));
        this.reportFile = builder.reportFile;
        this.networkFile = builder.networkFile;
    }

    /**
     * Creates configuration from environment variables.
     */
    public static SimulatorConfig fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    public static SimulatorConfig fromEnvironment(EnvironmentReader env) {
        Builder builder = new Builder()
                .synthesizer(SynthesizerConfig.fromEnvironment(env))
                .disaster(DisasterConfig.fromEnvironment(env))
                .analyzer(AnalyzerConfig.fromEnvironment(env))
                .coverage(CoverageConfig.fromEnvironment(env))
                .stations(parseStations(env.get("STATION_POINTS", "")))
                .reportFile(Paths.get(env.get("REPORT_FILE", DEFAULT_REPORT_FILE)));
        String trees = env.get("TREES_FILE", "");
        if (!trees.trim().isEmpty()) {
            builder.treesFile(Paths.get(trees.trim()));
        }
        String network = env.get("NETWORK_FILE", "");
        if (!network.trim().isEmpty()) {
            builder.networkFile(Paths.get(network.trim()));
        }
        return builder.build();
    }

    /**
     * Parses {@code "x:y;x:y"} station lists. Blank input gives an empty list.
     */
    public static List<Coordinate> parseStations(String value) {
        List<Coordinate> stations = new ArrayList<>();
        if (value == null || value.trim().isEmpty()) {
            return stations;
        }
        for (String part : value.split(";")) {
            String point = part.trim();
            if (point.isEmpty()) {
                continue;
            }
            String[] xy = point.split(":");
            if (xy.length != 2) {
                throw new IllegalArgumentException("Station must be written as x:y, got '" + point + "'");
            }
            try {
                stations.add(new Coordinate(Double.parseDouble(xy[0].trim()), Double.parseDouble(xy[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Station coordinates must be numbers, got '" + point + "'", e);
            }
        }
        return stations;
    }

    public SynthesizerConfig getSynthesizer() {
        return synthesizer;
    }

    public DisasterConfig getDisaster() {
        return disaster;
    }

    public AnalyzerConfig getAnalyzer() {
        return analyzer;
    }

    public CoverageConfig getCoverage() {
        return coverage;
    }

    public Optional<Path> getTreesFile() {
        return Optional.ofNullable(treesFile);
    }

    public List<Coordinate> getStations() {
        return stations;
    }

    public Path getReportFile() {
        return reportFile;
    }

    /** Where to dump the road graph after the disaster, if anywhere. */
    public Optional<Path> getNetworkFile() {
        return Optional.ofNullable(networkFile);
    }

    @Override
    public String toString() {
        return "SimulatorConfig{" +
                "synthesizer=" + synthesizer +
                ", disaster=" + disaster +
                ", analyzer=" + analyzer +
                ", coverage=" + coverage +
                ", treesFile=" + treesFile +
                ", stations=" + stations.size() +
                ", reportFile=" + reportFile +
                ", networkFile=" + networkFile +
                '}';
    }

    /**
     * Builder for SimulatorConfig.
     */
    public static final class Builder {
        private SynthesizerConfig synthesizer = SynthesizerConfig.defaults();
        private DisasterConfig disaster = DisasterConfig.defaults();
        private AnalyzerConfig analyzer = AnalyzerConfig.defaults();
        private CoverageConfig coverage = CoverageConfig.defaults();
        private Path treesFile;
        private List<Coordinate> stations = Collections.emptyList();
        private Path reportFile = Paths.get(DEFAULT_REPORT_FILE);
        private Path networkFile;

        public Builder synthesizer(SynthesizerConfig synthesizer) {
            this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
            return this;
        }

        public Builder disaster(DisasterConfig disaster) {
            this.disaster = Objects.requireNonNull(disaster, "disaster must not be null");
            return this;
        }

        public Builder analyzer(AnalyzerConfig analyzer) {
            this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
            return this;
        }

        public Builder coverage(CoverageConfig coverage) {
            this.coverage = Objects.requireNonNull(coverage, "coverage must not be null");
            return this;
        }

        public Builder treesFile(Path treesFile) {
            this.treesFile = treesFile;
            return this;
        }

        public Builder stations(List<Coordinate> stations) {
            this.stations = Objects.requireNonNull(stations, "stations must not be null");
            return this;
        }

        public Builder reportFile(Path reportFile) {
            this.reportFile = Objects.requireNonNull(reportFile, "reportFile must not be null");
            return this;
        }

        public Builder networkFile(Path networkFile) {
            this.networkFile = networkFile;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(this);
        }
    }
}
