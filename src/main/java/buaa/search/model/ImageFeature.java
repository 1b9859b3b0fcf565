package buaa.search.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 图片特征
 * assetUrl 全局唯一，重复索引同一图片时原地更新
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ImageFeature extends FeatureRecord {

    private String altText;

    public ImageFeature(String assetUrl, String sourcePageUrl, String altText, float[] embedding) {
        setAssetUrl(assetUrl);
        setSourcePageUrl(sourcePageUrl);
        setEmbedding(embedding);
        this.altText = altText;
    }

    @Override
    public Modality getModality() {
        return Modality.IMAGE;
    }

    @Override
    public String getUniqueKey() {
        return getAssetUrl();
    }
}
