package buaa.search.client;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.embedding.ImageEmbedder;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 远程图文联合空间向量化（CLIP 类模型）
 * 图片以 base64 编码的 PNG 传输
 */
@Component
public class RemoteImageEmbedder implements ImageEmbedder {

    private final EmbeddingApiClient apiClient;
    private final SearchEngineProperties.Model model;

    public RemoteImageEmbedder(EmbeddingApiClient apiClient, SearchEngineProperties properties) {
        this.apiClient = apiClient;
        this.model = properties.getModels().getImage();
    }

    @Override
    public List<float[]> embedImages(List<BufferedImage> images) {
        List<String> encoded = images.stream()
            .map(this::toBase64Png)
            .collect(Collectors.toList());
        return apiClient.encode(model.getName(), "image", encoded, model.getBatchSize(), null);
    }

    @Override
    public List<float[]> embedTextsInImageSpace(List<String> texts) {
        return apiClient.encode(model.getName(), "text-image", texts, model.getBatchSize(), null);
    }

    private String toBase64Png(BufferedImage image) {
        try (ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", output)) {
                throw new ClientException("图片无法转换为PNG", SearchErrorCode.IMAGE_DECODE_FAILED);
            }
            return Base64.getEncoder().encodeToString(output.toByteArray());
        } catch (IOException e) {
            throw new ClientException("图片编码失败", e, SearchErrorCode.IMAGE_DECODE_FAILED);
        }
    }
}
