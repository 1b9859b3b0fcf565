package buaa.search.service;

import buaa.search.audio.AudioDecoder;
import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.dto.AudioResult;
import buaa.search.dto.ImageResult;
import buaa.search.dto.SearchResultItem;
import buaa.search.dto.TextResult;
import buaa.search.embedding.AudioEmbedder;
import buaa.search.embedding.ImageEmbedder;
import buaa.search.embedding.TextEmbedder;
import buaa.search.media.ImageDecoder;
import buaa.search.model.AudioFeature;
import buaa.search.model.ImageFeature;
import buaa.search.model.Modality;
import buaa.search.model.TextFeature;
import buaa.search.repository.FeatureStores;
import buaa.search.repository.InMemoryFeatureStore;
import buaa.search.support.TestMedia;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrossModalRetrievalServiceTest {

    private static final int DIMENSION = 2;
    private static final float[] ORIGIN = {0f, 0f};

    @Mock private TextEmbedder textEmbedder;
    @Mock private ImageEmbedder imageEmbedder;
    @Mock private AudioEmbedder audioEmbedder;

    private InMemoryFeatureStore<TextFeature> textStore;
    private InMemoryFeatureStore<ImageFeature> imageStore;
    private InMemoryFeatureStore<AudioFeature> audioStore;
    private CrossModalRetrievalService service;

    @BeforeEach
    void setUp() {
        textStore = new InMemoryFeatureStore<>(Modality.TEXT, DIMENSION);
        imageStore = new InMemoryFeatureStore<>(Modality.IMAGE, DIMENSION);
        audioStore = new InMemoryFeatureStore<>(Modality.AUDIO, DIMENSION);
        lenient().when(audioEmbedder.samplingRate()).thenReturn(100);
        service = new CrossModalRetrievalService(textEmbedder, imageEmbedder, audioEmbedder,
            new FeatureStores(textStore, imageStore, audioStore),
            new ImageDecoder(), new AudioDecoder(), new SearchEngineProperties());
    }

    @Nested
    @DisplayName("以文检索")
    class ByText {

        @Test
        void returnsClosestRecordsInAscendingDistance() {
            textStore.insert(new TextFeature("http://a/10", "ten", new float[]{10f, 0f}));
            textStore.insert(new TextFeature("http://a/1", "one", new float[]{1f, 0f}));
            textStore.insert(new TextFeature("http://a/5", "five", new float[]{0f, 5f}));
            when(textEmbedder.embedTexts(List.of("numbers"))).thenReturn(List.of(ORIGIN));

            List<SearchResultItem> results = service.searchByText("numbers", Modality.TEXT, 2);

            assertThat(results).containsExactly(
                new TextResult("http://a/1", "one"),
                new TextResult("http://a/5", "five"));
        }

        @Test
        void imageQueriesUseTheImageTextSpace() {
            imageStore.upsert(new ImageFeature("http://a/cat.png", "http://a/", "cat", new float[]{1f, 1f}));
            when(imageEmbedder.embedTextsInImageSpace(List.of("cat"))).thenReturn(List.of(ORIGIN));

            List<SearchResultItem> results = service.searchByText("cat", Modality.IMAGE, 10);

            assertThat(results).containsExactly(new ImageResult("http://a/", "http://a/cat.png", "cat"));
            verify(textEmbedder, never()).embedTexts(anyList());
        }

        @Test
        void audioQueriesReturnChunkBoundaries() {
            audioStore.upsert(new AudioFeature("http://a/s.wav", "http://a/", 10, 20, new float[]{0f, 1f}));
            when(audioEmbedder.embedTextsInAudioSpace(List.of("dog barking"))).thenReturn(List.of(ORIGIN));

            List<SearchResultItem> results = service.searchByText("dog barking", Modality.AUDIO, 10);

            assertThat(results).containsExactly(new AudioResult("http://a/", "http://a/s.wav", 10, 20));
        }

        @Test
        void emptyStoreReturnsNothing() {
            when(textEmbedder.embedTexts(List.of("anything"))).thenReturn(List.of(ORIGIN));

            assertThat(service.searchByText("anything", Modality.TEXT, 10)).isEmpty();
        }

        @Test
        void rejectsBlankAndOverlongQueries() {
            assertThatThrownBy(() -> service.searchByText(" ", Modality.TEXT, 10))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.QUERY_EMPTY.code());
            assertThatThrownBy(() -> service.searchByText("x".repeat(201), Modality.TEXT, 10))
                .isInstanceOf(ClientException.class);
        }

        @Test
        void rejectsLimitOutsideRange() {
            assertThatThrownBy(() -> service.searchByText("q", Modality.TEXT, 0))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.LIMIT_OUT_OF_RANGE.code());
            assertThatThrownBy(() -> service.searchByText("q", Modality.TEXT, 51))
                .isInstanceOf(ClientException.class);
        }
    }

    @Nested
    @DisplayName("以文件检索")
    class ByFile {

        @Test
        void imageFileIsEmbeddedInImageSpace() {
            imageStore.upsert(new ImageFeature("http://a/near.png", "http://a/", "", new float[]{0f, 1f}));
            imageStore.upsert(new ImageFeature("http://a/far.png", "http://a/", "", new float[]{0f, 9f}));
            when(imageEmbedder.embedImages(anyList())).thenReturn(List.of(ORIGIN));

            List<SearchResultItem> results = service.searchByFile(TestMedia.png(3, 3), Modality.IMAGE, 1);

            assertThat(results).extracting(item -> ((ImageResult) item).getAssetUrl())
                .containsExactly("http://a/near.png");
        }

        @Test
        void audioFileIsDecodedAtModelRate() {
            audioStore.upsert(new AudioFeature("http://a/s.wav", "http://a/", 0, 10, new float[]{1f, 0f}));
            when(audioEmbedder.embedAudio(anyList())).thenReturn(List.of(ORIGIN));

            byte[] wav = TestMedia.wav(TestMedia.tone(2, 200, 0, 0), 200, 1);

            assertThat(service.searchByFile(wav, Modality.AUDIO, 5)).hasSize(1);
        }

        @Test
        void textTypeIsNotSupportedForFiles() {
            assertThatThrownBy(() -> service.searchByFile(TestMedia.png(1, 1), Modality.TEXT, 5))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED.code());
        }

        @Test
        void corruptUploadIsAClientError() {
            assertThatThrownBy(() -> service.searchByFile("garbage".getBytes(), Modality.IMAGE, 5))
                .isInstanceOf(ClientException.class)
                .extracting("errorCode")
                .isEqualTo(SearchErrorCode.IMAGE_DECODE_FAILED.code());
        }
    }
}
