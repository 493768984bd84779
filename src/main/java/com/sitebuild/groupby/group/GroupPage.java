package com.sitebuild.groupby.group;

import com.sitebuild.groupby.expression.PropertySource;
import com.sitebuild.groupby.model.ContentRecord;
import com.sitebuild.groupby.pagination.Paginator;

import java.util.List;

/**
 * One page of a paginated group. Page 1 shares the group's URL; later pages
 * get a URL derived with {@link Paginator#pageSlug(String, int, String)}.
 */
public class GroupPage implements VirtualNode, PropertySource {

    private final GroupBySource group;
    private final int pageNum;
    private final int pageCount;
    private final List<GroupChild> items;
    private final int totalItems;
    private final String urlSuffix;

    GroupPage(GroupBySource group, int pageNum, int pageCount, List<GroupChild> items, int totalItems,
              String urlSuffix) {
        this.group = group;
        this.pageNum = pageNum;
        this.pageCount = pageCount;
        this.items = List.copyOf(items);
        this.totalItems = totalItems;
        this.urlSuffix = urlSuffix;
    }

    public GroupBySource getGroup() {
        return group;
    }

    public int getPageNum() {
        return pageNum;
    }

    public int getPageCount() {
        return pageCount;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public List<GroupChild> getItems() {
        return items;
    }

    public List<ContentRecord> getRecords() {
        return items.stream().map(GroupChild::getRecord).toList();
    }

    public boolean hasPrev() {
        return pageNum > 1;
    }

    public boolean hasNext() {
        return pageNum < pageCount;
    }

    public GroupPage getPrev() {
        return hasPrev() ? group.getPage(pageNum - 1) : null;
    }

    public GroupPage getNext() {
        return hasNext() ? group.getPage(pageNum + 1) : null;
    }

    public String getSlug() {
        return Paginator.pageSlug(group.getSlug(), pageNum, urlSuffix);
    }

    @Override
    public String getPath() {
        return pageNum == 1 ? group.getPath() : group.getPath() + "/" + pageNum;
    }

    @Override
    public String getUrlPath() {
        String slug = getSlug();
        return slug == null ? null : UrlPaths.join(group.getRootRecord().getUrlPath(), slug);
    }

    @Override
    public String getTemplate() {
        return group.getTemplate();
    }

    @Override
    public List<String> getSourceFilenames() {
        return group.getSourceFilenames();
    }

    @Override
    public Object getProperty(String name) {
        return switch (name) {
            case "page", "page_num" -> pageNum;
            case "pages", "page_count" -> pageCount;
            case "items" -> getRecords();
            case "total", "total_items" -> totalItems;
            case "has_prev" -> hasPrev();
            case "has_next" -> hasNext();
            case "prev" -> getPrev();
            case "next" -> getNext();
            case "slug" -> getSlug();
            case "url_path" -> getUrlPath();
            case "path", "_path" -> getPath();
            case "group" -> group;
            default -> group.getProperty(name);
        };
    }

    @Override
    public String toString() {
        return "<GroupPage path=\"" + getPath() + "\" page=" + pageNum + "/" + pageCount + ">";
    }
}
