package buaa.search.controller;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.web.GlobalExceptionHandler;
import buaa.search.dto.CrawlResponse;
import buaa.search.dto.IngestionTaskView;
import buaa.search.model.IngestionTaskStatus;
import buaa.search.service.CrawlService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CrawlControllerTest {

    @Mock
    private CrawlService crawlService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CrawlController(crawlService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void acceptedCrawlEchoesEffectiveParameters() throws Exception {
        when(crawlService.startCrawl("http://site.example.com/", null, 0.5))
            .thenReturn(new CrawlResponse("http://site.example.com/", 10, 0.5));

        mockMvc.perform(post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seedUrl\":\"http://site.example.com/\",\"delay\":0.5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.seedUrl").value("http://site.example.com/"))
            .andExpect(jsonPath("$.data.limit").value(10));
    }

    @Test
    void blankSeedIsRejectedBeforeCrawling() throws Exception {
        mockMvc.perform(post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seedUrl\":\"\"}"))
            .andExpect(status().isBadRequest());
        verify(crawlService, never()).startCrawl(any(), any(), any());
    }

    @Test
    void negativeDelayIsRejected() throws Exception {
        mockMvc.perform(post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seedUrl\":\"http://site.example.com/\",\"delay\":-1}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void invalidSeedFromServiceIsBadRequest() throws Exception {
        when(crawlService.startCrawl("ftp://x/", null, null))
            .thenThrow(new ClientException(SearchErrorCode.SEED_URL_INVALID));

        mockMvc.perform(post("/api/crawl")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seedUrl\":\"ftp://x/\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(SearchErrorCode.SEED_URL_INVALID.code()));
    }

    @Test
    void listsFailedTasksByDefault() throws Exception {
        IngestionTaskView view = new IngestionTaskView();
        view.setTaskId("t-1");
        view.setStatus("FAILED");
        view.setAttempts(4);
        when(crawlService.listTasks(IngestionTaskStatus.FAILED)).thenReturn(List.of(view));

        mockMvc.perform(get("/api/ingestion/tasks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].taskId").value("t-1"))
            .andExpect(jsonPath("$.data[0].attempts").value(4));
    }

    @Test
    void unknownStatusIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/ingestion/tasks").param("status", "BOGUS"))
            .andExpect(status().isBadRequest());
    }
}
