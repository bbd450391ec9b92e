package org.example.pysolver.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.example.pysolver.model.PassResult;

import java.util.List;
import java.util.Objects;

/**
 * The document written at the end of a run: run metadata plus one result per index.
 */
@JsonPropertyOrder({"metadata", "result"})
public class SolverReport {

    private final Metadata metadata;
    private final List<PassResult> result;

    public SolverReport(Metadata metadata, List<PassResult> result) {
        this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
        this.result = List.copyOf(result);
    }

    @JsonProperty("metadata")
    public Metadata getMetadata() {
        return metadata;
    }

    @JsonProperty("result")
    public List<PassResult> getResult() {
        return result;
    }

    public static Metadata.Builder metadata() {
        return new Metadata.Builder();
    }

    /**
     * Describes how the run was configured.
     */
    @JsonPropertyOrder({"analyzer", "analyzer_version", "datetime", "python_version",
            "index_urls", "transitive", "exclude_packages", "duration_ms"})
    public static class Metadata {
        private final String analyzer;
        private final String analyzerVersion;
        private final String datetime;
        private final int pythonVersion;
        private final List<String> indexUrls;
        private final boolean transitive;
        private final List<String> excludePackages;
        private final long durationMs;

        private Metadata(Builder builder) {
            this.analyzer = builder.analyzer;
            this.analyzerVersion = builder.analyzerVersion;
            this.datetime = builder.datetime;
            this.pythonVersion = builder.pythonVersion;
            this.indexUrls = List.copyOf(builder.indexUrls);
            this.transitive = builder.transitive;
            this.excludePackages = List.copyOf(builder.excludePackages);
            this.durationMs = builder.durationMs;
        }

        @JsonProperty("analyzer")
        public String getAnalyzer() {
            return analyzer;
        }

        @JsonProperty("analyzer_version")
        public String getAnalyzerVersion() {
            return analyzerVersion;
        }

        /**
         * ISO-8601 instant the run started at.
         */
        @JsonProperty("datetime")
        public String getDatetime() {
            return datetime;
        }

        @JsonProperty("python_version")
        public int getPythonVersion() {
            return pythonVersion;
        }

        @JsonProperty("index_urls")
        public List<String> getIndexUrls() {
            return indexUrls;
        }

        @JsonProperty("transitive")
        public boolean isTransitive() {
            return transitive;
        }

        @JsonProperty("exclude_packages")
        public List<String> getExcludePackages() {
            return excludePackages;
        }

        @JsonProperty("duration_ms")
        public long getDurationMs() {
            return durationMs;
        }

        public static class Builder {
            private String analyzer = "pysolver-maven-plugin";
            private String analyzerVersion = "unknown";
            private String datetime;
            private int pythonVersion = 3;
            private List<String> indexUrls = List.of();
            private boolean transitive = true;
            private List<String> excludePackages = List.of();
            private long durationMs;

            public Builder analyzer(String analyzer) {
                this.analyzer = analyzer;
                return this;
            }

            public Builder analyzerVersion(String analyzerVersion) {
                this.analyzerVersion = analyzerVersion != null ? analyzerVersion : "unknown";
                return this;
            }

            public Builder datetime(String datetime) {
                this.datetime = datetime;
                return this;
            }

            public Builder pythonVersion(int pythonVersion) {
                this.pythonVersion = pythonVersion;
                return this;
            }

            public Builder indexUrls(List<String> indexUrls) {
                this.indexUrls = indexUrls != null ? indexUrls : List.of();
                return this;
            }

            public Builder transitive(boolean transitive) {
                this.transitive = transitive;
                return this;
            }

            public Builder excludePackages(List<String> excludePackages) {
                this.excludePackages = excludePackages != null ? excludePackages : List.of();
                return this;
            }

            public Builder durationMs(long durationMs) {
                this.durationMs = durationMs;
                return this;
            }

            public Metadata build() {
                return new Metadata(this);
            }
        }
    }
}
