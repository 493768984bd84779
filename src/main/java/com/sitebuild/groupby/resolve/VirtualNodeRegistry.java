package com.sitebuild.groupby.resolve;

import com.sitebuild.groupby.group.VirtualNode;

import java.util.Optional;
import java.util.Set;

/**
 * The host's table of addressable nodes, keyed by URL path.
 */
public interface VirtualNodeRegistry {

    Set<String> urlPaths();

    Optional<VirtualNode> get(String urlPath);

    void register(String urlPath, VirtualNode node);

    boolean remove(String urlPath);
}
