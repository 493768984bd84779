package com.sitebuild.groupby.support;

import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.model.ContentTree;
import com.sitebuild.groupby.model.DataModel;
import com.sitebuild.groupby.model.FieldDefinition;
import com.sitebuild.groupby.model.FieldType;
import com.sitebuild.groupby.model.FlowBlockModel;

import java.util.Map;

/**
 * Small blog-shaped content trees for tests.
 *
 * Layout: {@code /} with {@code /blog} (posts below it) and {@code /about}.
 * Posts use model {@code blog-post}: {@code title}, {@code date},
 * {@code tags} (flagged {@code tags}), {@code category} (flagged
 * {@code category}) and a flow field {@code body} whose {@code text} blocks
 * flag {@code keywords} with {@code inlinetags}.
 */
public final class ContentFixtures {

    public static final String POST_MODEL = "blog-post";

    private ContentFixtures() {
    }

    public static ContentTree blogTree() {
        ContentRecord root = new ContentRecord("/", "page", Map.of("title", "Home"));
        ContentRecord blog = new ContentRecord("/blog", "blog", Map.of("title", "Blog"));
        ContentRecord about = new ContentRecord("/about", "page", Map.of("title", "About"));
        root.addChild(blog);
        root.addChild(about);

        return new ContentTree(root)
                .addDataModel(DataModel.builder().id("page")
                        .field(FieldDefinition.builder().name("title").build())
                        .build())
                .addDataModel(DataModel.builder().id("blog")
                        .field(FieldDefinition.builder().name("title").build())
                        .build())
                .addDataModel(DataModel.builder().id(POST_MODEL)
                        .field(FieldDefinition.builder().name("title").build())
                        .field(FieldDefinition.builder().name("date").build())
                        .field(FieldDefinition.builder().name("tags").option("tags", "true").build())
                        .field(FieldDefinition.builder().name("category").option("category", "yes").build())
                        .field(FieldDefinition.builder().name("body").type(FieldType.FLOW).build())
                        .build())
                .addFlowBlockModel(FlowBlockModel.builder().id("text")
                        .field(FieldDefinition.builder().name("content").build())
                        .field(FieldDefinition.builder().name("keywords").option("inlinetags", "true").build())
                        .build())
                .addFlowBlockModel(FlowBlockModel.builder().id("image")
                        .field(FieldDefinition.builder().name("src").build())
                        .build());
    }

    /**
     * Add a post below {@code /blog}.
     */
    public static ContentRecord addPost(ContentTree tree, String slug, Map<String, ?> values) {
        ContentRecord blog = tree.get("/blog").orElseThrow();
        ContentRecord post = new ContentRecord("/blog/" + slug, POST_MODEL, values);
        blog.addChild(post);
        return post;
    }

    /**
     * Add a post below an arbitrary parent path.
     */
    public static ContentRecord addPost(ContentTree tree, String parentPath, String slug, Map<String, ?> values) {
        ContentRecord parent = tree.get(parentPath).orElseThrow();
        String base = "/".equals(parent.getPath()) ? "" : parent.getPath();
        ContentRecord post = new ContentRecord(base + "/" + slug, POST_MODEL, values);
        parent.addChild(post);
        return post;
    }
}
