package buaa.search.controller;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;
import buaa.search.common.convention.result.Result;
import buaa.search.common.convention.result.Results;
import buaa.search.dto.SearchResultItem;
import buaa.search.dto.TextSearchRequest;
import buaa.search.model.Modality;
import buaa.search.service.CrossModalRetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * 检索接口
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    private final CrossModalRetrievalService retrievalService;

    public SearchController(CrossModalRetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * 以文本检索
     * GET /api/search?q=xxx&type=text|image|audio&limit=10
     */
    @GetMapping("/search")
    public Result<List<SearchResultItem>> searchByText(@Valid @ModelAttribute TextSearchRequest request) {
        Modality modality = Modality.fromValue(request.getType());
        return Results.success(retrievalService.searchByText(request.getQ(), modality, request.getLimit()));
    }

    /**
     * 以文件检索（以图搜图、以音搜音）
     * POST /api/search  multipart: file, type=image|audio, limit
     */
    @PostMapping(value = "/search", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Result<List<SearchResultItem>> searchByFile(@RequestParam("file") MultipartFile file,
                                                       @RequestParam(defaultValue = "image") String type,
                                                       @RequestParam(defaultValue = "10") int limit) {
        Modality modality = Modality.fromValue(type);
        if (file.isEmpty()) {
            throw new ClientException("上传文件不能为空", SearchErrorCode.PARAM_EMPTY);
        }

        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            throw new ClientException("上传文件读取失败: " + e.getMessage(), SearchErrorCode.PARAM_INVALID);
        }
        return Results.success(retrievalService.searchByFile(data, modality, limit));
    }
}
