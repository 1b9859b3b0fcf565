package buaa.search.dto;

import buaa.search.model.TextFeature;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文本检索结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextResult implements SearchResultItem {

    @JsonProperty("source_page_url")
    private String sourcePageUrl;

    /** 匹配的文本片段 */
    @JsonProperty("content")
    private String content;

    public static TextResult from(TextFeature feature) {
        return new TextResult(feature.getSourcePageUrl(), feature.getContent());
    }
}
