package buaa.search.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 爬取请求
 */
@Data
public class CrawlRequest {

    @NotBlank(message = "起始地址不能为空")
    private String seedUrl;

    /** 最多访问的页面数 */
    @Min(value = 1, message = "页面数量至少为1")
    private Integer limit;

    /** 抓取间隔（秒） */
    @DecimalMin(value = "0.0", message = "抓取间隔不能为负数")
    private Double delay;
}
