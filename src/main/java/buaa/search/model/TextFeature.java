package buaa.search.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 文本片段特征
 * 不设唯一约束，重复抓取的相同片段会作为新记录写入
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TextFeature extends FeatureRecord {

    /** 片段原文 */
    private String content;

    public TextFeature(String sourcePageUrl, String content, float[] embedding) {
        setSourcePageUrl(sourcePageUrl);
        setEmbedding(embedding);
        this.content = content;
    }

    @Override
    public Modality getModality() {
        return Modality.TEXT;
    }

    @Override
    public String getUniqueKey() {
        return null;
    }
}
