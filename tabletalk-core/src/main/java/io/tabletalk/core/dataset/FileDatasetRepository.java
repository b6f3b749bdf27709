package io.tabletalk.core.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tabletalk.core.model.Dataset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class FileDatasetRepository implements DatasetRepository {
    private static final TypeReference<List<Dataset>> DATASETS = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public FileDatasetRepository(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void save(Dataset dataset) throws IOException {
        List<Dataset> all = new ArrayList<>(load());
        all.removeIf(existing -> existing.id().equals(dataset.id()));
        all.add(dataset);
        write(all);
    }

    @Override
    public synchronized Optional<Dataset> find(String datasetId) throws IOException {
        if (datasetId == null || datasetId.isBlank()) {
            return Optional.empty();
        }
        return load().stream().filter(dataset -> dataset.id().equals(datasetId)).findFirst();
    }

    @Override
    public synchronized List<Dataset> list() throws IOException {
        return load().stream()
            .sorted(Comparator.comparing(Dataset::uploadedAt).reversed())
            .toList();
    }

    private List<Dataset> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return mapper.readValue(Files.readString(path), DATASETS);
    }

    private void write(List<Dataset> datasets) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(datasets);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
