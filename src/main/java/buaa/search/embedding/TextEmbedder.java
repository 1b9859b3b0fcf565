package buaa.search.embedding;

import java.util.List;

/**
 * 文本向量化
 */
public interface TextEmbedder {

    /**
     * 在纯文本向量空间中编码
     *
     * @param texts 文本列表
     * @return 与输入一一对应的向量
     */
    List<float[]> embedTexts(List<String> texts);
}
