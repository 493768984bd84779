package com.sitebuild.groupby.config;

import com.sitebuild.groupby.exception.ConfigException;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GroupByConfigTest {

    @Test
    void testDefaults() {
        GroupByConfig config = GroupByConfig.of("tags");

        assertThat(config.getRoot()).isEqualTo("/");
        assertThat(config.getSlug()).isEqualTo("tags/{key}/index.html");
        assertThat(config.getTemplate()).isEqualTo("groupby-tags.html");
        assertThat(config.isEnabled()).isTrue();
        assertThat(config.isAddressable()).isTrue();
        assertThat(config.getPagination().isEnabled()).isFalse();
        assertThat(config.getPagination().getPerPage()).isEqualTo(20);
        assertThat(config.getOrderBy()).isEmpty();
    }

    @Test
    void testNoneSlugIsNotAddressable() {
        GroupByConfig config = GroupByConfig.builder().attribute("tags").slug("None").build();

        assertThat(config.getSlug()).isNull();
        assertThat(config.isAddressable()).isFalse();
    }

    @Test
    void testRootIsNormalized() {
        assertThat(GroupByConfig.builder().attribute("tags").root("blog/").build().getRoot()).isEqualTo("/blog");
    }

    @Test
    void testInvalidAttribute() {
        assertThatThrownBy(() -> GroupByConfig.of("tags.fields")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> GroupByConfig.of(" ")).isInstanceOf(ConfigException.class);
    }

    @Test
    void testInvalidOrderBy() {
        GroupByConfig config = GroupByConfig.of("tags");

        assertThatThrownBy(() -> config.setOrderBy("-date, 1st"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("[tags.children.order_by]");
        assertThat(config.getOrderBy()).isEmpty();
    }

    @Test
    void testInvalidPagination() {
        GroupByConfig config = GroupByConfig.of("tags");

        assertThatThrownBy(() -> config.setPagination(PaginationSettings.perPage(0)))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("per_page");
        assertThatThrownBy(() -> config.setPagination(PaginationSettings.builder().urlSuffix("a/b").build()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("url_suffix");
    }

    @Test
    void testFromMap() {
        Map<String, Object> values = new HashMap<>();
        values.put("root", "/blog");
        values.put("enabled", "no");
        values.put("pagination.per_page", 10);
        values.put("fields", Map.of("title", "this.key?upper_case"));
        values.put("key_map", Map.of("Blog", "News"));

        GroupByConfig config = GroupByConfig.fromMap("tags", values);

        assertThat(config.getRoot()).isEqualTo("/blog");
        assertThat(config.isEnabled()).isFalse();
        assertThat(config.getPagination().isEnabled()).isTrue();
        assertThat(config.getPagination().getPerPage()).isEqualTo(10);
        assertThat(config.getFields()).containsOnlyKeys("title");
        assertThat(config.getKeyMap()).containsEntry("Blog", "News");
    }

    @Test
    void testFromMapPaginationWithoutPerPage() {
        GroupByConfig config = GroupByConfig.fromMap("tags", Map.of("pagination.enabled", "true"));

        assertThat(config.getPagination().isEnabled()).isTrue();
        assertThat(config.getPagination().getPerPage()).isEqualTo(PaginationSettings.DEFAULT_PER_PAGE);
    }

    @Test
    void testSameSettings() {
        GroupByConfig a = GroupByConfig.fromMap("tags", Map.of("root", "/blog", "split", ","));
        GroupByConfig b = GroupByConfig.fromMap("tags", Map.of("root", "/blog", "split", ","));
        GroupByConfig c = GroupByConfig.fromMap("tags", Map.of("root", "/blog", "split", ";"));

        assertThat(a.hasSameSettings(b)).isTrue();
        assertThat(a.hasSameSettings(c)).isFalse();
    }

    @Test
    void testViewIsReadOnlySnapshot() {
        GroupByConfig config = GroupByConfig.of("tags");
        config.addDependency("templates/groupby-tags.html");

        ConfigView view = config.view();

        assertThat(view.getKey()).isEqualTo("tags");
        assertThat(view.getDependencies()).containsExactly("templates/groupby-tags.html");
        assertThatThrownBy(() -> view.getDependencies().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
