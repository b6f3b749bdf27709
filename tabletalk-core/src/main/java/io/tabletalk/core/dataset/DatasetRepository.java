package io.tabletalk.core.dataset;

import io.tabletalk.core.model.Dataset;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface DatasetRepository {
    void save(Dataset dataset) throws IOException;

    Optional<Dataset> find(String datasetId) throws IOException;

    List<Dataset> list() throws IOException;
}
