package io.tabletalk.core.dataset;

public class DatasetLoadException extends RuntimeException {
    private final String datasetId;

    public DatasetLoadException(String datasetId, String message, Throwable cause) {
        super(message, cause);
        this.datasetId = datasetId;
    }

    public String datasetId() {
        return datasetId;
    }
}
