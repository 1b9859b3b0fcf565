package buaa.search.service;

import buaa.search.common.convention.exception.ClientException;
import buaa.search.config.SearchEngineProperties;
import buaa.search.crawler.CrawlReport;
import buaa.search.crawler.FrontierCrawler;
import buaa.search.dto.CrawlResponse;
import buaa.search.dto.IngestionTaskView;
import buaa.search.model.IngestionTaskRecord;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.model.Modality;
import buaa.search.repository.IngestionTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlServiceTest {

    @Mock private FrontierCrawler crawler;
    @Mock private IngestionTaskRepository taskRepository;

    private CrawlService service;

    @BeforeEach
    void setUp() {
        service = new CrawlService(crawler, Runnable::run, taskRepository, new SearchEngineProperties());
    }

    @Test
    void backgroundCrawlAppliesDefaults() {
        when(crawler.crawl("http://site.example.com/", 10, Duration.ofSeconds(1)))
            .thenReturn(new CrawlReport("http://site.example.com/"));

        CrawlResponse response = service.startCrawl("http://site.example.com/", null, null);

        assertThat(response.getLimit()).isEqualTo(10);
        assertThat(response.getDelaySeconds()).isEqualTo(1.0);
        verify(crawler).crawl("http://site.example.com/", 10, Duration.ofSeconds(1));
    }

    @Test
    void crawlerFailureInBackgroundIsContained() {
        when(crawler.crawl(any(), anyInt(), any())).thenThrow(new IllegalStateException("boom"));

        CrawlResponse response = service.startCrawl("http://site.example.com/", 2, 0.0);

        assertThat(response.getSeedUrl()).isEqualTo("http://site.example.com/");
    }

    @Test
    void invalidParametersAreRejectedBeforeScheduling() {
        assertThatThrownBy(() -> service.startCrawl("mailto:x@y.z", 5, 1.0)).isInstanceOf(ClientException.class);
        assertThatThrownBy(() -> service.startCrawl("http://site.example.com/", 0, 1.0)).isInstanceOf(ClientException.class);
        assertThatThrownBy(() -> service.startCrawl("http://site.example.com/", 5, -0.5)).isInstanceOf(ClientException.class);
        verify(crawler, never()).crawl(any(), anyInt(), any());
    }

    @Test
    void listsTasksFromLedger() {
        IngestionTaskRecord record = new IngestionTaskRecord();
        record.setTaskId("t-1");
        record.setTaskType(Modality.AUDIO);
        record.setStatus(IngestionTaskStatus.FAILED);
        record.setAttempts(4);
        when(taskRepository.findByStatusOrderByUpdatedAtDesc(IngestionTaskStatus.FAILED, PageRequest.of(0, 100)))
            .thenReturn(List.of(record));

        List<IngestionTaskView> views = service.listTasks(IngestionTaskStatus.FAILED);

        assertThat(views).singleElement().satisfies(view -> {
            assertThat(view.getTaskType()).isEqualTo("audio");
            assertThat(view.getStatus()).isEqualTo("FAILED");
            assertThat(view.getAttempts()).isEqualTo(4);
        });
    }
}
