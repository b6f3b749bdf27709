package io.tabletalk.core.dataset;

import java.io.IOException;

public interface DatasetStorage {
    String store(String name, byte[] bytes) throws IOException;

    byte[] read(String key) throws IOException;
}
