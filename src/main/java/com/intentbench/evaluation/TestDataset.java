package com.intentbench.evaluation;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestDataset(
        Metadata metadata,
        List<TestSample> samples) {

    public TestDataset {
        metadata = metadata == null ? Metadata.empty() : metadata;
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    /**
     * Returns a dataset holding at most the first {@code limit} samples.
     */
    public TestDataset limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("sample limit must be >= 0 but was " + limit);
        }
        if (limit >= samples.size()) {
            return this;
        }
        return new TestDataset(metadata, samples.subList(0, limit));
    }

    public int size() {
        return samples.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
            String created,
            Integer totalSamples,
            Integer samplesPerCategory,
            Map<String, Integer> distribution,
            Map<String, Integer> sources) {

        public Metadata {
            distribution = distribution == null ? Map.of() : Map.copyOf(distribution);
            sources = sources == null ? Map.of() : Map.copyOf(sources);
        }

        static Metadata empty() {
            return new Metadata(null, null, null, Map.of(), Map.of());
        }
    }
}
