package com.sitebuild.groupby.resolve;

import com.sitebuild.groupby.group.VirtualNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryNodeRegistry implements VirtualNodeRegistry {

    private final Map<String, VirtualNode> nodes = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public Set<String> urlPaths() {
        synchronized (nodes) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(nodes.keySet()));
        }
    }

    @Override
    public Optional<VirtualNode> get(String urlPath) {
        return Optional.ofNullable(nodes.get(urlPath));
    }

    @Override
    public void register(String urlPath, VirtualNode node) {
        nodes.put(urlPath, node);
    }

    @Override
    public boolean remove(String urlPath) {
        return nodes.remove(urlPath) != null;
    }

    public int size() {
        return nodes.size();
    }
}
