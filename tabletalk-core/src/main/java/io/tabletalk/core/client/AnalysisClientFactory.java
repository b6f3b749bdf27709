package io.tabletalk.core.client;

@FunctionalInterface
public interface AnalysisClientFactory {
    AnalysisClient create();
}
