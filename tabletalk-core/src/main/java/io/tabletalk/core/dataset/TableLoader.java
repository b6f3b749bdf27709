package io.tabletalk.core.dataset;

import io.tabletalk.core.model.Table;

@FunctionalInterface
public interface TableLoader {
    Table load(String datasetId, String fingerprint) throws Exception;
}
