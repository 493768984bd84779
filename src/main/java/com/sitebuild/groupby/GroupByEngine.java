package com.sitebuild.groupby;

import com.sitebuild.groupby.cache.BuildCache;
import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.config.IniConfigParser;
import com.sitebuild.groupby.config.IniDocument;
import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.expression.ExpressionEvaluator;
import com.sitebuild.groupby.expression.FreemarkerExpressionEvaluator;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.GroupPage;
import com.sitebuild.groupby.group.VirtualNode;
import com.sitebuild.groupby.key.DefaultSlugifier;
import com.sitebuild.groupby.key.KeyResolver;
import com.sitebuild.groupby.key.Slugifier;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.query.GroupQuery;
import com.sitebuild.groupby.resolve.VirtualNodeRegistry;
import com.sitebuild.groupby.resolve.VirtualPathResolver;
import com.sitebuild.groupby.watcher.GroupAggregator;
import com.sitebuild.groupby.watcher.QuickConfigCallback;
import com.sitebuild.groupby.watcher.Watcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for the host build: registers watchers, answers path lookups
 * and group queries, and forwards change notifications.
 */
public class GroupByEngine {
    private static final Logger log = LoggerFactory.getLogger(GroupByEngine.class);

    private final ContentTree tree;
    private final GroupAggregator aggregator;
    private final BuildCache cache = new BuildCache();
    private final VirtualPathResolver resolver = new VirtualPathResolver(cache);
    private final IniConfigParser configParser = new IniConfigParser();

    public GroupByEngine(ContentTree tree) {
        this(tree, new DefaultSlugifier(), new FreemarkerExpressionEvaluator());
    }

    /**
     * @param keyTypes host value types that grouping callbacks may yield as keys
     */
    public GroupByEngine(ContentTree tree, Slugifier slugifier, ExpressionEvaluator evaluator, Class<?>... keyTypes) {
        this.tree = tree;
        this.aggregator = new GroupAggregator(tree, new KeyResolver(slugifier, evaluator, keyTypes), evaluator);
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    public Watcher addWatcher(String attribute, GroupByConfig config, boolean preBuild) {
        if (!attribute.equals(config.getAttribute())) {
            throw new ConfigException(attribute, "attribute", config.getAttribute(),
                    "does not match the watched attribute");
        }
        return cache.register(new Watcher(config, preBuild, aggregator));
    }

    public Watcher addWatcher(String attribute, GroupByConfig config) {
        return addWatcher(attribute, config, false);
    }

    public Watcher addWatcher(String attribute, Map<String, ?> config, boolean preBuild) {
        return addWatcher(attribute, GroupByConfig.fromMap(attribute, config), preBuild);
    }

    /**
     * Register a watcher from the {@code [attribute]} section of a config file.
     * The file becomes a dependency of the watcher.
     */
    public Watcher addWatcher(String attribute, Path configFile, boolean preBuild) throws IOException {
        IniDocument doc = configParser.parse(configFile);
        return addWatcher(attribute, configParser.toConfig(doc, attribute), preBuild);
    }

    /**
     * Register one watcher per top-level section of a config file, each
     * grouping by the field value (split by the section's {@code split}).
     */
    public List<Watcher> loadQuickConfig(Path configFile) throws IOException {
        IniDocument doc = configParser.parse(configFile);
        List<Watcher> result = new ArrayList<>();
        for (String section : configParser.watcherSections(doc)) {
            GroupByConfig config = configParser.toConfig(doc, section);
            Watcher watcher = addWatcher(section, config, false);
            if (watcher.getCallback() == null) {
                watcher.setGrouping(new QuickConfigCallback(config.getSplit()), true);
            }
            result.add(watcher);
        }
        log.info("Loaded {} quick config watcher(s) from {}", result.size(), configFile);
        return result;
    }

    // -------------------------------------------------------------------------
    // Build lifecycle
    // -------------------------------------------------------------------------

    /**
     * Start a new build run: all cached groups are dropped and rebuilt on access.
     */
    public void startBuild() {
        cache.startBuild();
    }

    /**
     * Run the pre-build watchers. Called before any record is rendered, so
     * their callbacks can still change source content. They rebuild on every call.
     */
    public void beforeRender() {
        for (Watcher watcher : cache.watchers()) {
            if (watcher.isPreBuild()) {
                watcher.markStale();
                watcher.groups();
            }
        }
    }

    /**
     * A record, file or other dependency changed.
     *
     * @return the watchers that became stale
     */
    public List<Watcher> notifyChanged(String identifier) {
        return cache.invalidate(identifier);
    }

    /**
     * Build every enabled watcher and list every addressable group and
     * later page, in registration and group order.
     */
    public List<VirtualNode> buildAll() {
        List<VirtualNode> nodes = new ArrayList<>();
        for (Watcher watcher : cache.watchers()) {
            resolver.refresh(watcher);
            for (GroupBySource group : watcher.groups().groups()) {
                if (group.getUrlPath() == null) {
                    continue;
                }
                nodes.add(group);
                for (GroupPage page : group.getPages()) {
                    if (page.getPageNum() > 1) {
                        nodes.add(page);
                    }
                }
            }
        }
        return nodes;
    }

    /**
     * Retract group nodes the host still knows but that no longer exist.
     *
     * @return the retracted URL paths
     */
    public List<String> prune(VirtualNodeRegistry registry) {
        return resolver.prune(registry);
    }

    // -------------------------------------------------------------------------
    // Lookups
    // -------------------------------------------------------------------------

    public Optional<VirtualNode> resolve(String path) {
        return resolver.resolve(path);
    }

    public GroupQuery query(ContentRecord parent) {
        return new GroupQuery(cache, parent);
    }

    public Optional<Watcher> getWatcher(String attribute, String root) {
        return cache.get(attribute, root);
    }

    public List<Watcher> getWatchers() {
        return cache.watchers();
    }

    /**
     * Union of all declared config dependencies.
     */
    public Set<String> getDependencies() {
        Set<String> result = new LinkedHashSet<>();
        for (Watcher watcher : cache.watchers()) {
            result.addAll(watcher.getConfig().getDependencies());
        }
        return result;
    }

    public ContentTree getTree() {
        return tree;
    }

    public VirtualPathResolver getResolver() {
        return resolver;
    }
}
