package com.sitebuild.groupby.resolve;

import com.sitebuild.groupby.cache.BuildCache;
import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.exception.GroupByException;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.GroupPage;
import com.sitebuild.groupby.group.GroupSet;
import com.sitebuild.groupby.group.UrlPaths;
import com.sitebuild.groupby.group.VirtualNode;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.watcher.Watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps URL paths and virtual paths to groups and their pages.
 *
 * A watcher's entries are replaced wholesale whenever its group set
 * changes. When two watchers claim the same URL, the one registered first
 * keeps it no matter which of them was built first.
 *
 * A URL lookup only builds watchers whose root and literal slug prefix can
 * produce that URL. A watcher that fails to build is logged and skipped so
 * the other candidates still answer.
 */
public class VirtualPathResolver {
    private static final Logger log = LoggerFactory.getLogger(VirtualPathResolver.class);

    private static final List<String> SLUG_MARKERS = List.of(GroupBySource.KEY_TOKEN, "${", "<#");

    private record Entry(VirtualNode node, Watcher owner, int order) {
    }

    private final BuildCache cache;
    private final Map<String, Entry> byUrl = new LinkedHashMap<>();
    private final Map<String, String> urlByPath = new HashMap<>();
    private final Map<Watcher, GroupSet> published = new IdentityHashMap<>();

    public VirtualPathResolver(BuildCache cache) {
        this.cache = cache;
    }

    /**
     * Resolve a URL path ({@code /blog/tags/awesome/}) or a virtual path
     * ({@code /blog@groupby/tags/awesome/2}). Watchers that may own the path
     * are built first if needed.
     */
    public Optional<VirtualNode> resolve(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (path.contains(VirtualNode.VIRTUAL_PATH_MARKER + "/")) {
            return resolveVirtualPath(path);
        }
        String url = UrlPaths.normalize(path);
        GroupByException failure = null;
        for (Watcher watcher : cache.watchers()) {
            if (!mayOwn(watcher, url)) {
                continue;
            }
            try {
                refresh(watcher);
            } catch (GroupByException e) {
                log.warn("Skipping [{}] under {} while resolving {}: {}",
                        watcher.getConfig().getAttribute(), watcher.getRoot(), url, e.getMessage());
                if (failure == null) {
                    failure = e;
                }
            }
        }
        Entry entry;
        synchronized (this) {
            entry = byUrl.get(url);
            if (entry == null && !url.endsWith("/")) {
                entry = byUrl.get(url + "/");
            }
        }
        if (entry == null && failure != null) {
            throw failure;
        }
        return Optional.ofNullable(entry).map(Entry::node);
    }

    /**
     * Whether {@code url} lies under the watcher's root and starts with the
     * literal part of its slug.
     */
    static boolean mayOwn(Watcher watcher, String url) {
        GroupByConfig config = watcher.getConfig();
        if (!config.isAddressable() || !ContentRecord.isUnder(url, watcher.getRoot())) {
            return false;
        }
        String root = watcher.getRoot();
        String rootUrl = ContentRecord.ROOT_PATH.equals(root) ? ContentRecord.ROOT_PATH : root + "/";
        String prefix = UrlPaths.join(rootUrl, slugPrefix(config.getSlug()));
        return url.startsWith(prefix) || (url + "/").startsWith(prefix);
    }

    /**
     * Text of {@code slug} before its first key token or template marker.
     * A slug that is a bare expression has no literal prefix.
     */
    static String slugPrefix(String slug) {
        int end = slug.length();
        boolean dynamic = false;
        for (String marker : SLUG_MARKERS) {
            int at = slug.indexOf(marker);
            if (at >= 0) {
                end = Math.min(end, at);
                dynamic = true;
            }
        }
        if (!dynamic) {
            return "";
        }
        return slug.substring(0, end);
    }

    private Optional<VirtualNode> resolveVirtualPath(String path) {
        int marker = path.indexOf(VirtualNode.VIRTUAL_PATH_MARKER + "/");
        String root = ContentRecord.normalizePath(path.substring(0, marker));
        String[] parts = path.substring(marker + VirtualNode.VIRTUAL_PATH_MARKER.length() + 1).split("/");
        if (parts.length < 2 || parts.length > 3) {
            return Optional.empty();
        }
        Optional<GroupBySource> group = cache.get(parts[0], root)
                .flatMap(watcher -> watcher.findGroup(parts[1]));
        if (group.isEmpty() || parts.length == 2) {
            return group.map(VirtualNode.class::cast);
        }
        int page;
        try {
            page = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        GroupBySource source = group.get();
        if (!source.isPaginated()) {
            return page == 1 ? Optional.of(source) : Optional.empty();
        }
        if (page < 1 || page > source.getPageCount()) {
            return Optional.empty();
        }
        return Optional.of(source.getPage(page));
    }

    /**
     * URL under which the node with the given virtual path is published, if any.
     */
    public synchronized Optional<String> urlOf(String virtualPath) {
        return Optional.ofNullable(urlByPath.get(virtualPath));
    }

    /**
     * Bring the entries of {@code watcher} up to date, building it if needed.
     * The build itself runs outside the resolver lock.
     */
    public void refresh(Watcher watcher) {
        GroupSet set = watcher.groups();
        synchronized (this) {
            if (published.get(watcher) == set) {
                return;
            }
            boolean retracted = retract(watcher);
            int order = cache.registrationIndex(watcher);
            for (GroupBySource group : set.groups()) {
                if (group.getUrlPath() == null) {
                    continue;
                }
                publish(group.getUrlPath(), group, watcher, order);
                if (group.isPaginated()) {
                    for (GroupPage page : group.getPages()) {
                        if (page.getPageNum() > 1) {
                            publish(page.getUrlPath(), page, watcher, order);
                        }
                    }
                }
            }
            published.put(watcher, set);
            if (retracted) {
                // URLs this watcher gave up may now belong to a watcher it used to hide
                published.keySet().removeIf(other -> other != watcher);
            }
        }
    }

    private boolean retract(Watcher watcher) {
        List<String> urls = new ArrayList<>();
        byUrl.forEach((url, entry) -> {
            if (entry.owner() == watcher) {
                urls.add(url);
            }
        });
        for (String url : urls) {
            Entry removed = byUrl.remove(url);
            urlByPath.remove(removed.node().getPath());
        }
        return !urls.isEmpty();
    }

    private void publish(String url, VirtualNode node, Watcher owner, int order) {
        Entry existing = byUrl.get(url);
        if (existing != null) {
            if (existing.owner() == owner || existing.order() < order) {
                log.warn("URL {} of {} is already taken by {}; skipping", url, node.getPath(), existing.node().getPath());
                return;
            }
            log.warn("URL {} moves from {} to {} (registered earlier)", url, existing.node().getPath(), node.getPath());
            urlByPath.remove(existing.node().getPath());
        }
        byUrl.put(url, new Entry(node, owner, order));
        urlByPath.put(node.getPath(), url);
    }

    /**
     * Register every currently resolvable node with the host.
     */
    public void publish(VirtualNodeRegistry registry) {
        for (Watcher watcher : cache.watchers()) {
            refresh(watcher);
        }
        Map<String, VirtualNode> snapshot = new LinkedHashMap<>();
        synchronized (this) {
            byUrl.forEach((url, entry) -> snapshot.put(url, entry.node()));
        }
        snapshot.forEach(registry::register);
    }

    /**
     * Remove group nodes from the host that no longer resolve (key gone,
     * slug changed or watcher disabled), then publish the current ones.
     *
     * @return the retracted URL paths
     */
    public List<String> prune(VirtualNodeRegistry registry) {
        for (Watcher watcher : cache.watchers()) {
            refresh(watcher);
        }
        List<String> retracted = new ArrayList<>();
        for (String url : registry.urlPaths()) {
            boolean groupNode = registry.get(url)
                    .map(node -> node.getPath() != null && node.getPath().contains(VirtualNode.VIRTUAL_PATH_MARKER))
                    .orElse(false);
            boolean current;
            synchronized (this) {
                current = byUrl.containsKey(url);
            }
            if (groupNode && !current) {
                registry.remove(url);
                retracted.add(url);
                log.info("Pruned stale group node {}", url);
            }
        }
        publish(registry);
        return retracted;
    }

    /**
     * Number of URLs currently published.
     */
    public synchronized int size() {
        return byUrl.size();
    }
}
