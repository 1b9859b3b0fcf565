package buaa.search.service;

import buaa.search.crawler.AudioAsset;
import buaa.search.crawler.ImageAsset;
import buaa.search.model.Modality;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.UUID;

/**
 * 摄取任务
 * 一个可重复执行的工作单元：任务类型 + 参数 + 幂等键
 */
@Getter
@ToString(exclude = "content")
public final class IngestionTask {

    private final String taskId;
    private final Modality type;
    private final String idempotencyKey;
    private final String sourcePageUrl;
    /** 文本内容，仅文本任务 */
    private final String content;
    /** 资源地址，仅媒体任务 */
    private final String assetUrl;
    /** 图片 alt 文本，仅图片任务 */
    private final String altText;

    private IngestionTask(Modality type, String sourcePageUrl, String content, String assetUrl, String altText) {
        this.taskId = UUID.randomUUID().toString();
        this.type = type;
        this.sourcePageUrl = sourcePageUrl;
        this.content = content;
        this.assetUrl = assetUrl;
        this.altText = altText;
        this.idempotencyKey = type == Modality.TEXT
            ? DigestUtils.md5Hex(type + "|" + sourcePageUrl + "|" + content)
            : DigestUtils.md5Hex(type + "|" + assetUrl);
    }

    public static IngestionTask text(String content, String sourcePageUrl) {
        return new IngestionTask(Modality.TEXT, sourcePageUrl, content, null, null);
    }

    public static IngestionTask image(ImageAsset image, String sourcePageUrl) {
        return new IngestionTask(Modality.IMAGE, sourcePageUrl, null, image.getUrl(),
            image.getAltText() == null ? "" : image.getAltText());
    }

    public static IngestionTask audio(AudioAsset audio, String sourcePageUrl) {
        return new IngestionTask(Modality.AUDIO, sourcePageUrl, null, audio.getUrl(), null);
    }
}
