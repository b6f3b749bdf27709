package io.tabletalk.core.client;

public interface AnalysisClient {
    AnalysisResult analyze(AnalysisRequest request);
}
