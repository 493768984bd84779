package com.sitebuild.groupby.query;

import com.sitebuild.groupby.GroupByEngine;
import com.sitebuild.groupby.cache.DependencyTracker;
import com.sitebuild.groupby.config.GroupByConfig;
import com.sitebuild.groupby.group.GroupBySource;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.model.Flow;
import com.sitebuild.groupby.model.FlowBlock;
import com.sitebuild.groupby.support.ContentFixtures;
import com.sitebuild.groupby.watcher.QuickConfigCallback;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GroupQueryTest {

    private ContentTree tree;
    private GroupByEngine engine;
    private ContentRecord blog;
    private ContentRecord first;

    @BeforeEach
    void setUp() {
        tree = ContentFixtures.blogTree();
        blog = tree.get("/blog").orElseThrow();
        first = ContentFixtures.addPost(tree, "first", Map.of(
                "tags", List.of("Awesome", "Latest News"),
                "body", Flow.of(new FlowBlock("text", Map.of("content", "Hello", "keywords", "Java, Maven")))));
        ContentFixtures.addPost(tree, "second", Map.of("tags", List.of("Latest News")));
        ContentFixtures.addPost(tree, "/blog/first", "nested", Map.of("tags", List.of("Deep")));

        engine = new GroupByEngine(tree);
        engine.addWatcher("tags", GroupByConfig.builder().attribute("tags").root("/blog").build())
                .setGrouping(new QuickConfigCallback(null))
                .dependsOn("configs/tags.ini");
        engine.addWatcher("inlinetags", GroupByConfig.builder().attribute("inlinetags").root("/blog").build())
                .setGrouping(new QuickConfigCallback(","));
    }

    private static List<String> keys(List<GroupBySource> groups) {
        return groups.stream().map(GroupBySource::getKey).toList();
    }

    @Test
    void testGroupsOfSingleRecord() {
        assertThat(keys(engine.query(first).list())).containsExactly("awesome", "latest-news", "java", "maven");
        assertThat(keys(engine.query(first).keys("tags").list())).containsExactly("awesome", "latest-news");
    }

    @Test
    void testNonRecursiveByDefault() {
        assertThat(engine.query(blog).list()).isEmpty();
    }

    @Test
    void testRecursiveFirstSeenOrderWithoutDuplicates() {
        List<GroupBySource> groups = engine.query(blog).keys("tags").recursive(true).list();

        assertThat(keys(groups)).containsExactly("awesome", "latest-news", "deep");
    }

    @Test
    void testOrderBy() {
        assertThat(keys(engine.query(blog).keys("tags").recursive(true).orderBy("-key").list()))
                .containsExactly("latest-news", "deep", "awesome");
        assertThat(keys(engine.query(blog).keys("tags").recursive(true).orderBy("-count", "key").list()))
                .containsExactly("latest-news", "awesome", "deep");
    }

    @Test
    void testFieldAndFlowFilters() {
        assertThat(keys(engine.query(blog).recursive(true).flows("keywords").list()))
                .containsExactly("java", "maven");
        assertThat(keys(engine.query(blog).recursive(true).fields("body").list()))
                .containsExactly("java", "maven");
        assertThat(keys(engine.query(blog).recursive(true).fields("tags").list()))
                .containsExactly("awesome", "latest-news", "deep");
    }

    @Test
    void testRecordsDependencies() {
        DependencyTracker tracker = new DependencyTracker();

        engine.query(blog).keys("tags").recursive(true).recordingTo(tracker).list();

        assertThat(tracker.getDependencies()).containsExactly(
                "configs/tags.ini", "/blog", "/blog/first", "/blog/second", "/blog/first/nested");
        assertThat(tracker.contains("/about")).isFalse();
    }

    @Test
    void testQueryBuildsWatcherOnce() {
        engine.query(blog).recursive(true).list();
        engine.query(first).list();

        assertThat(engine.getWatcher("tags", "/blog")).get()
                .extracting(watcher -> watcher.getBuildCount()).isEqualTo(1);
    }
}
