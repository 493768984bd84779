package com.sitebuild.groupby.group;

import java.util.List;

/**
 * Something the host can address and render although no source file backs it.
 */
public interface VirtualNode {
    String VIRTUAL_PATH_MARKER = "@groupby";

    /**
     * Stable virtual path, e.g. {@code /blog@groupby/tags/awesome}.
     */
    String getPath();

    /**
     * Browser-facing URL path, or {@code null} if the node is not addressable.
     */
    String getUrlPath();

    String getTemplate();

    /**
     * Files whose change must trigger a re-render of this node.
     */
    List<String> getSourceFilenames();

    /**
     * Artifact path relative to the output root, e.g. {@code blog/tags/awesome/index.html}.
     */
    default String getArtifactPath() {
        String url = getUrlPath();
        if (url == null) {
            return null;
        }
        if (url.endsWith("/")) {
            url = url + "index.html";
        }
        return url.startsWith("/") ? url.substring(1) : url;
    }
}
