package buaa.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 特征记录基类
 * 三种模态的索引文档共享的字段
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class FeatureRecord {

    /** 文档唯一标识 */
    private String id;

    /** 资源地址，文本记录为空 */
    private String assetUrl;

    /** 发现该内容的页面地址 */
    private String sourcePageUrl;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /** 向量表示 */
    private float[] embedding;

    /**
     * 记录所属模态
     */
    @JsonIgnore
    public abstract Modality getModality();

    /**
     * 去重键，同一键的多次写入只保留一条记录；文本记录返回 null
     */
    @JsonIgnore
    public abstract String getUniqueKey();
}
