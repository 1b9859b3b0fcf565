package buaa.search.crawler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 页面中发现的图片资源
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageAsset {

    /** 绝对地址 */
    private String url;

    /** alt 文本，缺省为空串 */
    private String altText;
}
