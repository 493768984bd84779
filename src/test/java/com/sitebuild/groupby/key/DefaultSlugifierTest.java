package com.sitebuild.groupby.key;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DefaultSlugifierTest {

    private final DefaultSlugifier slugifier = new DefaultSlugifier();

    @Test
    void testLowercasesAndDashesSpaces() {
        assertThat(slugifier.slugify("Latest News")).isEqualTo("latest-news");
        assertThat(slugifier.slugify("Awesome")).isEqualTo("awesome");
    }

    @Test
    void testFoldsAccents() {
        assertThat(slugifier.slugify("Café Über")).isEqualTo("cafe-uber");
    }

    @Test
    void testDropsEdgeDashes() {
        assertThat(slugifier.slugify("C#")).isEqualTo("c");
        assertThat(slugifier.slugify("  -- hello world! --  ")).isEqualTo("hello-world");
    }

    @Test
    void testKeepsDotsAndUnderscores() {
        assertThat(slugifier.slugify("v1.2_beta")).isEqualTo("v1.2_beta");
    }

    @Test
    void testNothingLeft() {
        assertThat(slugifier.slugify("###")).isEmpty();
        assertThat(slugifier.slugify(null)).isEmpty();
    }
}
