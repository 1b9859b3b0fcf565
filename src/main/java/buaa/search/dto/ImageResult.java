package buaa.search.dto;

import buaa.search.model.ImageFeature;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 图片检索结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageResult implements SearchResultItem {

    @JsonProperty("source_page_url")
    private String sourcePageUrl;

    @JsonProperty("asset_url")
    private String assetUrl;

    @JsonProperty("alt_text")
    private String altText;

    public static ImageResult from(ImageFeature feature) {
        return new ImageResult(feature.getSourcePageUrl(), feature.getAssetUrl(), feature.getAltText());
    }
}
