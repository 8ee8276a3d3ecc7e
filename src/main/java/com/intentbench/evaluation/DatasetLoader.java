package com.intentbench.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a labeled dataset from JSON. Any problem with the file, its syntax or its labels is
 * reported as a {@link DatasetLoadException}.
 */
public class DatasetLoader {
    private final ObjectMapper objectMapper;

    public DatasetLoader() {
        this(new ObjectMapper());
    }

    DatasetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TestDataset load(Path path) throws DatasetLoadException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DatasetLoadException("Dataset file not found: " + path);
        }
        TestDataset dataset;
        try {
            dataset = objectMapper.readValue(path.toFile(), TestDataset.class);
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
        if (dataset == null) {
            throw new DatasetLoadException("Dataset " + path + " is empty");
        }
        for (int i = 0; i < dataset.samples().size(); i++) {
            TestSample sample = dataset.samples().get(i);
            if (sample == null || sample.input() == null) {
                throw new DatasetLoadException("Sample #" + (i + 1) + " in " + path + " has no input");
            }
            if (sample.expected() == null) {
                throw new DatasetLoadException("Sample #" + (i + 1) + " in " + path + " has no expected label");
            }
        }
        return dataset;
    }
}
