package buaa.search.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 音频分块特征
 * (assetUrl, beginStampSeconds) 全局唯一
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AudioFeature extends FeatureRecord {

    /** 分块起始秒 */
    private Integer beginStampSeconds;

    /** 分块结束秒 */
    private Integer endStampSeconds;

    public AudioFeature(String assetUrl, String sourcePageUrl,
                        int beginStampSeconds, int endStampSeconds, float[] embedding) {
        setAssetUrl(assetUrl);
        setSourcePageUrl(sourcePageUrl);
        setEmbedding(embedding);
        this.beginStampSeconds = beginStampSeconds;
        this.endStampSeconds = endStampSeconds;
    }

    @Override
    public Modality getModality() {
        return Modality.AUDIO;
    }

    @Override
    public String getUniqueKey() {
        return getAssetUrl() + "#" + beginStampSeconds;
    }
}
