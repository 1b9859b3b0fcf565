package buaa.search.service;

import buaa.search.audio.AudioDecoder;
import buaa.search.client.AssetDownloader;
import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.convention.exception.ServiceException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.crawler.AudioAsset;
import buaa.search.crawler.ImageAsset;
import buaa.search.media.ImageDecoder;
import buaa.search.model.AudioFeature;
import buaa.search.model.ImageFeature;
import buaa.search.model.Modality;
import buaa.search.model.TextFeature;
import buaa.search.repository.FeatureStores;
import buaa.search.repository.InMemoryFeatureStore;
import buaa.search.support.FakeEmbedder;
import buaa.search.support.TestMedia;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final String PAGE = "http://site.example.com/page.html";
    private static final String SONG = "http://site.example.com/song.wav";

    @Mock
    private AssetDownloader assetDownloader;

    private InMemoryFeatureStore<TextFeature> textStore;
    private InMemoryFeatureStore<ImageFeature> imageStore;
    private InMemoryFeatureStore<AudioFeature> audioStore;
    private SearchEngineProperties properties;

    @BeforeEach
    void setUp() {
        textStore = new InMemoryFeatureStore<>(Modality.TEXT, FakeEmbedder.DIMENSION);
        imageStore = new InMemoryFeatureStore<>(Modality.IMAGE, FakeEmbedder.DIMENSION);
        audioStore = new InMemoryFeatureStore<>(Modality.AUDIO, FakeEmbedder.DIMENSION);
        properties = new SearchEngineProperties();
    }

    private IngestionService service() {
        FakeEmbedder embedder = new FakeEmbedder();
        return new IngestionService(embedder, embedder, embedder,
            new FeatureStores(textStore, imageStore, audioStore),
            assetDownloader, new AudioDecoder(), new ImageDecoder(), properties);
    }

    @Test
    void textFragmentsAreInsertedWithoutDeduplication() {
        IngestionService service = service();

        service.ingestText("hello world", PAGE);
        service.ingestText("hello world", PAGE);

        assertThat(textStore.all()).hasSize(2)
            .allSatisfy(feature -> {
                assertThat(feature.getContent()).isEqualTo("hello world");
                assertThat(feature.getSourcePageUrl()).isEqualTo(PAGE);
                assertThat(feature.getAssetUrl()).isNull();
            });
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> service().ingestText("  ", PAGE))
            .isInstanceOf(ClientException.class);
        assertThat(textStore.size()).isZero();
    }

    @Nested
    @DisplayName("图片")
    class Images {

        @Test
        void downloadedImageIsUpsertedByAssetUrl() {
            String asset = "http://site.example.com/cat.png";
            when(assetDownloader.download(asset)).thenReturn(TestMedia.png(4, 3));
            IngestionService service = service();

            service.ingestImage(new ImageAsset(asset, "a cat"), PAGE);
            service.ingestImage(new ImageAsset(asset, "still a cat"), PAGE);

            assertThat(imageStore.all()).hasSize(1);
            ImageFeature stored = imageStore.all().get(0);
            assertThat(stored.getAssetUrl()).isEqualTo(asset);
            assertThat(stored.getAltText()).isEqualTo("still a cat");
            assertThat(stored.getEmbedding()).containsExactly(FakeEmbedder.ofText("4x3"));
        }

        @Test
        void corruptImageFailsWithoutWriting() {
            assertThatThrownBy(() -> service().indexImage("not an image".getBytes(), "http://x/a.png", PAGE, ""))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.IMAGE_DECODE_FAILED.code());
            assertThat(imageStore.size()).isZero();
        }

        @Test
        void downloadFailurePropagatesForRetry() {
            String asset = "http://site.example.com/gone.png";
            when(assetDownloader.download(asset))
                .thenThrow(new ServiceException("404", SearchErrorCode.ASSET_DOWNLOAD_FAILED));

            assertThatThrownBy(() -> service().ingestImage(new ImageAsset(asset, ""), PAGE))
                .isInstanceOf(ServiceException.class);
        }
    }

    @Nested
    @DisplayName("音频")
    class Audio {

        @Test
        void audioIsChunkedAndSilentChunksAreSkipped() {
            // 25 秒，10-20 秒静音：3 个分块，中间一块跳过
            byte[] wav = TestMedia.wav(TestMedia.tone(25, 1000, 10, 20), 1000, 1);

            int written = service().indexAudio(wav, SONG, PAGE);

            assertThat(written).isEqualTo(2);
            assertThat(audioStore.all())
                .extracting(AudioFeature::getBeginStampSeconds, AudioFeature::getEndStampSeconds)
                .containsExactlyInAnyOrder(
                    tuple(0, 10),
                    tuple(20, 30));
        }

        @Test
        void silentChunksAreKeptWhenSkippingIsDisabled() {
            properties.getIngestion().setSkipSilentChunks(false);
            byte[] wav = TestMedia.wav(TestMedia.tone(25, 1000, 10, 20), 1000, 1);

            assertThat(service().indexAudio(wav, SONG, PAGE)).isEqualTo(3);
            assertThat(audioStore.size()).isEqualTo(3);
        }

        @Test
        void reindexingTheSameAudioDoesNotDuplicateChunks() {
            byte[] wav = TestMedia.wav(TestMedia.tone(12, 1000, 100, 100), 1000, 2);
            when(assetDownloader.download(SONG)).thenReturn(wav);
            IngestionService service = service();

            service.ingestAudio(new AudioAsset(SONG), PAGE);
            service.ingestAudio(new AudioAsset(SONG), PAGE);

            assertThat(audioStore.all()).hasSize(2);
            assertThat(audioStore.all()).allSatisfy(chunk -> assertThat(chunk.getAssetUrl()).isEqualTo(SONG));
        }

        @Test
        void corruptAudioIsAClientError() {
            assertThatThrownBy(() -> service().indexAudio(new byte[]{1, 2, 3, 4}, SONG, PAGE))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.AUDIO_DECODE_FAILED.code());
        }
    }

    @Test
    void executeRoutesTasksByType() {
        String asset = "http://site.example.com/dog.png";
        when(assetDownloader.download(asset)).thenReturn(TestMedia.png(2, 2));
        IngestionService service = service();

        service.execute(IngestionTask.text("fragment", PAGE));
        service.execute(IngestionTask.image(new ImageAsset(asset, "dog"), PAGE));

        assertThat(textStore.size()).isEqualTo(1);
        assertThat(imageStore.all()).extracting(ImageFeature::getAltText).containsExactly("dog");
    }
}
