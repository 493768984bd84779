package com.sitebuild.groupby;

import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.config.PaginationSettings;
import com.sitebuild.groupby.exception.ConfigException;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.group.VirtualNode;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.support.ContentFixtures;
import com.sitebuild.groupby.watcher.QuickConfigCallback;
import com.sitebuild.groupby.watcher.Watcher;
import com.sitebuild.groupby.watcher.WatcherState;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GroupByEngineTest {

    private ContentTree tree;
    private GroupByEngine engine;

    @BeforeEach
    void setUp() {
        tree = ContentFixtures.blogTree();
        ContentFixtures.addPost(tree, "first", Map.of("tags", "Awesome, Latest News", "category", "Java"));
        ContentFixtures.addPost(tree, "second", Map.of("tags", "Latest News", "category", "Java"));
        engine = new GroupByEngine(tree);
    }

    private static GroupByConfig tags(String slug) {
        return GroupByConfig.builder().attribute("tags").root("/blog").slug(slug).split(",").build();
    }

    @Test
    void testRegisteringSameSettingsTwiceReturnsExistingWatcher() {
        Watcher first = engine.addWatcher("tags", tags(null));
        Watcher again = engine.addWatcher("tags", tags(null));

        assertThat(again).isSameAs(first);
        assertThat(engine.getWatchers()).hasSize(1);
    }

    @Test
    void testConflictingRegistration() {
        engine.addWatcher("tags", tags(null));

        assertThatThrownBy(() -> engine.addWatcher("tags", tags("topics/{key}/")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("different settings");
        assertThat(engine.getWatchers()).hasSize(1);
    }

    @Test
    void testSameAttributeDifferentRoots() {
        engine.addWatcher("tags", tags(null));
        engine.addWatcher("tags", GroupByConfig.builder().attribute("tags").root("/about").build());

        assertThat(engine.getWatchers()).hasSize(2);
        assertThat(engine.getWatcher("tags", "/about/")).isPresent();
    }

    @Test
    void testAttributeMismatch() {
        assertThatThrownBy(() -> engine.addWatcher("category", tags(null)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("category.attribute");
    }

    @Test
    void testMapConfig() {
        Watcher watcher = engine.addWatcher("tags", Map.of(
                "root", "/blog",
                "split", ",",
                "slug", "t/{key}/",
                "pagination.per_page", 1), false);
        watcher.setGrouping(new QuickConfigCallback(watcher.getConfig().getSplit()));

        GroupBySource latest = watcher.getGroup("latest-news");

        assertThat(latest.getUrlPath()).isEqualTo("/blog/t/latest-news/");
        assertThat(latest.getPageCount()).isEqualTo(2);
    }

    @Test
    void testLoadQuickConfig(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("groupby.ini");
        Files.write(file, List.of(
                "[tags]",
                "root = /blog",
                "split = ,",
                "",
                "[category]",
                "root = /blog",
                "slug = topic/{key}.html"));

        List<Watcher> watchers = engine.loadQuickConfig(file);

        assertThat(watchers).extracting(Watcher::getAttribute).containsExactly("tags", "category");
        assertThat(watchers.get(0).getCallback()).isInstanceOf(QuickConfigCallback.class);
        assertThat(engine.resolve("/blog/tags/latest-news/")).isPresent();
        assertThat(engine.resolve("/blog/topic/java.html")).isPresent();
        assertThat(engine.getDependencies()).containsExactly(file.toString());

        List<Watcher> reloaded = engine.loadQuickConfig(file);
        assertThat(reloaded.get(0)).isSameAs(watchers.get(0));
    }

    @Test
    void testConfigFileChangeInvalidatesWatcher(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("groupby.ini");
        Files.write(file, List.of("[tags]", "root = /blog", "split = ,"));
        Watcher watcher = engine.addWatcher("tags", file, false).setGrouping(new QuickConfigCallback(","));
        watcher.groups();

        List<Watcher> affected = engine.notifyChanged(file.toString());

        assertThat(affected).containsExactly(watcher);
        assertThat(watcher.state()).isEqualTo(WatcherState.STALE);
    }

    @Test
    void testUnrelatedChangeKeepsGroups() {
        Watcher watcher = engine.addWatcher("tags", tags(null)).setGrouping(new QuickConfigCallback(","));
        watcher.groups();

        assertThat(engine.notifyChanged("/about")).isEmpty();
        assertThat(watcher.state()).isEqualTo(WatcherState.BUILT);
        assertThat(engine.notifyChanged("/blog/second")).containsExactly(watcher);
    }

    @Test
    void testPreBuildWatcherRunsBeforeRender() {
        List<String> seen = new ArrayList<>();
        Watcher watcher = engine.addWatcher("tags", tags(null), true).setGrouping((occurrence, sink) -> {
            seen.add(occurrence.record().getPath());
            new QuickConfigCallback(",").group(occurrence, sink);
        });
        Watcher lazy = engine.addWatcher("category",
                GroupByConfig.builder().attribute("category").root("/blog").build())
                .setGrouping(new QuickConfigCallback(null));

        engine.beforeRender();
        engine.beforeRender();

        assertThat(watcher.getBuildCount()).isEqualTo(2);
        assertThat(seen).containsExactly("/blog/first", "/blog/second", "/blog/first", "/blog/second");
        assertThat(lazy.state()).isEqualTo(WatcherState.UNBUILT);
    }

    @Test
    void testStartBuildResetsWatchers() {
        Watcher watcher = engine.addWatcher("tags", tags(null)).setGrouping(new QuickConfigCallback(","));
        watcher.groups();

        engine.startBuild();

        assertThat(watcher.state()).isEqualTo(WatcherState.UNBUILT);
        assertThat(engine.resolve("/blog/tags/awesome/")).isPresent();
        assertThat(watcher.getBuildCount()).isEqualTo(2);
    }

    @Test
    void testBuildAll() {
        GroupByConfig paged = tags(null);
        paged.setPagination(PaginationSettings.perPage(1));
        engine.addWatcher("tags", paged).setGrouping(new QuickConfigCallback(","));
        engine.addWatcher("category", GroupByConfig.builder().attribute("category").root("/blog").slug("none").build())
                .setGrouping(new QuickConfigCallback(null));

        List<VirtualNode> nodes = engine.buildAll();

        assertThat(nodes).extracting(VirtualNode::getUrlPath).containsExactly(
                "/blog/tags/awesome/", "/blog/tags/latest-news/", "/blog/tags/latest-news/page/2/");
        assertThat(engine.getWatcher("category", "/blog")).get()
                .satisfies(watcher -> assertThat(watcher.getGroup("java").size()).isEqualTo(2));
    }

    @Test
    void testQuery() {
        engine.addWatcher("tags", tags(null)).setGrouping(new QuickConfigCallback(","));
        ContentRecord first = tree.get("/blog/first").orElseThrow();

        assertThat(engine.query(first).list()).extracting(GroupBySource::getKey)
                .containsExactly("awesome", "latest-news");
    }
}
