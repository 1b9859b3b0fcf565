package buaa.search.crawler;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * 单个页面的抽取结果
 */
@Getter
@AllArgsConstructor
public class PageFragments {

    /** 按文档顺序排列的可见文本 */
    private final List<String> texts;

    private final Set<ImageAsset> images;

    private final Set<AudioAsset> audios;

    /** 同源 http(s) 出链 */
    private final Set<String> links;

    public boolean isEmpty() {
        return texts.isEmpty() && images.isEmpty() && audios.isEmpty();
    }
}
