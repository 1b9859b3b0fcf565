package buaa.search.embedding;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * 图文联合空间向量化
 */
public interface ImageEmbedder {

    List<float[]> embedImages(List<BufferedImage> images);

    /**
     * 将文本编码到图片向量空间，用于以文搜图
     */
    List<float[]> embedTextsInImageSpace(List<String> texts);
}
