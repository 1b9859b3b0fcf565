package buaa.search.service;

import buaa.search.audio.AudioChunk;
import buaa.search.audio.AudioChunker;
import buaa.search.audio.AudioDecoder;
import buaa.search.client.AssetDownloader;
import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.crawler.AudioAsset;
import buaa.search.crawler.ImageAsset;
import buaa.search.embedding.AudioEmbedder;
import buaa.search.embedding.ImageEmbedder;
import buaa.search.embedding.TextEmbedder;
import buaa.search.media.ImageDecoder;
import buaa.search.model.AudioFeature;
import buaa.search.model.ImageFeature;
import buaa.search.model.TextFeature;
import buaa.search.repository.FeatureStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * 内容摄取服务
 *
 * <p>同步完成单条内容的下载、解码、向量化与写入，是摄取队列调用的工作单元，
 * 也可由命令行直接调用。每个操作都可安全重试：文本重复写入只会多出等价记录，
 * 图片与音频分块按去重键 upsert。</p>
 */
@Service
public class IngestionService implements IngestionTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final TextEmbedder textEmbedder;
    private final ImageEmbedder imageEmbedder;
    private final AudioEmbedder audioEmbedder;
    private final FeatureStores stores;
    private final AssetDownloader assetDownloader;
    private final AudioDecoder audioDecoder;
    private final ImageDecoder imageDecoder;
    private final AudioChunker audioChunker;
    private final boolean skipSilentChunks;

    public IngestionService(TextEmbedder textEmbedder,
                            ImageEmbedder imageEmbedder,
                            AudioEmbedder audioEmbedder,
                            FeatureStores stores,
                            AssetDownloader assetDownloader,
                            AudioDecoder audioDecoder,
                            ImageDecoder imageDecoder,
                            SearchEngineProperties properties) {
        this.textEmbedder = textEmbedder;
        this.imageEmbedder = imageEmbedder;
        this.audioEmbedder = audioEmbedder;
        this.stores = stores;
        this.assetDownloader = assetDownloader;
        this.audioDecoder = audioDecoder;
        this.imageDecoder = imageDecoder;
        this.audioChunker = new AudioChunker(
            properties.getModels().getAudio().getInputLenSeconds(),
            audioEmbedder.samplingRate());
        this.skipSilentChunks = properties.getIngestion().isSkipSilentChunks();
    }

    @Override
    public void execute(IngestionTask task) {
        switch (task.getType()) {
            case TEXT:
                ingestText(task.getContent(), task.getSourcePageUrl());
                break;
            case IMAGE:
                ingestImage(new ImageAsset(task.getAssetUrl(), task.getAltText()), task.getSourcePageUrl());
                break;
            case AUDIO:
                ingestAudio(new AudioAsset(task.getAssetUrl()), task.getSourcePageUrl());
                break;
            default:
                throw new ClientException("未知的任务类型: " + task.getType(), SearchErrorCode.PARAM_INVALID);
        }
    }

    /**
     * 索引文本片段
     *
     * @param content 片段文本
     * @param sourceUrl 来源页面
     */
    public void ingestText(String content, String sourceUrl) {
        if (content == null || content.isBlank()) {
            throw new ClientException("文本内容不能为空", SearchErrorCode.PARAM_EMPTY);
        }
        float[] embedding = single(textEmbedder.embedTexts(List.of(content)));
        stores.text().insert(new TextFeature(sourceUrl, content, embedding));
        log.debug("文本片段已索引: {}", sourceUrl);
    }

    /**
     * 下载并索引图片
     */
    public void ingestImage(ImageAsset image, String sourceUrl) {
        byte[] data = assetDownloader.download(image.getUrl());
        indexImage(data, image.getUrl(), sourceUrl, image.getAltText());
    }

    /**
     * 索引已获取的图片内容，按 assetUrl upsert
     *
     * @param data 图片字节
     * @param assetUrl 图片原始地址
     * @param sourceUrl 来源页面
     * @param altText alt 文本
     */
    public void indexImage(byte[] data, String assetUrl, String sourceUrl, String altText) {
        requireAssetUrl(assetUrl);
        BufferedImage image = imageDecoder.decode(data);
        float[] embedding = single(imageEmbedder.embedImages(List.of(image)));
        stores.image().upsert(new ImageFeature(assetUrl, sourceUrl, altText == null ? "" : altText, embedding));
        log.info("图片已索引: {}", assetUrl);
    }

    /**
     * 下载并索引音频
     *
     * @return 写入的分块数
     */
    public int ingestAudio(AudioAsset audio, String sourceUrl) {
        byte[] data = assetDownloader.download(audio.getUrl());
        return indexAudio(data, audio.getUrl(), sourceUrl);
    }

    /**
     * 解码、分块并逐块索引音频，按 (assetUrl, 起始秒) upsert
     *
     * @return 写入的分块数
     */
    public int indexAudio(byte[] data, String assetUrl, String sourceUrl) {
        requireAssetUrl(assetUrl);
        float[] waveform = audioDecoder.decode(data, audioEmbedder.samplingRate());
        if (waveform.length == 0) {
            log.warn("音频为空，未写入分块: {}", assetUrl);
            return 0;
        }

        int written = 0;
        for (AudioChunk chunk : audioChunker.chunk(waveform)) {
            if (skipSilentChunks && chunk.isSilent()) {
                log.debug("跳过静音分块: {} {}s-{}s", assetUrl, chunk.getStartSeconds(), chunk.getEndSeconds());
                continue;
            }
            float[] embedding = single(audioEmbedder.embedAudio(List.of(chunk.getSamples())));
            stores.audio().upsert(new AudioFeature(assetUrl, sourceUrl,
                chunk.getStartSeconds(), chunk.getEndSeconds(), embedding));
            written++;
        }
        log.info("音频已索引: {}, 分块 {}/{}", assetUrl, written, audioChunker.chunkCount(waveform.length));
        return written;
    }

    private void requireAssetUrl(String assetUrl) {
        if (assetUrl == null || assetUrl.isBlank()) {
            throw new ClientException("资源地址不能为空", SearchErrorCode.PARAM_EMPTY);
        }
    }

    private float[] single(List<float[]> vectors) {
        if (vectors == null || vectors.size() != 1 || vectors.get(0) == null) {
            throw new ServiceException("向量化服务返回结果异常", SearchErrorCode.EMBEDDING_SERVICE_ERROR);
        }
        return vectors.get(0);
    }
}
