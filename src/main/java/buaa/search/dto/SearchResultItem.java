package buaa.search.dto;

/**
 * 检索结果条目
 */
public interface SearchResultItem {

    /**
     * 内容所在页面
     */
    String getSourcePageUrl();
}
