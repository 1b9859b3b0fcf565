package buaa.search.crawler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 页面中发现的音频资源
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AudioAsset {

    /** 绝对地址 */
    private String url;
}
