package com.signalwatch.scan.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryObjectStore implements ObjectStore {
    private final ConcurrentMap<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public Optional<byte[]> get(String key) {
        byte[] content = objects.get(key);
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    @Override
    public void put(String key, byte[] content) {
        objects.put(key, content.clone());
    }

    public int size() {
        return objects.size();
    }
}
