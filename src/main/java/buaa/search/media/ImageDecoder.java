package buaa.search.media;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * 图片解码与校验
 * 先按文件头识别类型，再用 ImageIO 完整解码，任一步失败即视为损坏文件
 */
@Component
public class ImageDecoder {

    private final Tika tika = new Tika();

    public BufferedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ClientException("图片内容为空", SearchErrorCode.IMAGE_DECODE_FAILED);
        }
        String mediaType = tika.detect(data);
        if (!mediaType.startsWith("image/")) {
            throw new ClientException("不是图片文件: " + mediaType, SearchErrorCode.IMAGE_DECODE_FAILED);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException | RuntimeException e) {
            throw new ClientException("图片解码失败", e, SearchErrorCode.IMAGE_DECODE_FAILED);
        }
        if (image == null) {
            throw new ClientException("不支持的图片格式: " + mediaType, SearchErrorCode.IMAGE_DECODE_FAILED);
        }
        return image;
    }
}
