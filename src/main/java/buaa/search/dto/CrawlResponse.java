package buaa.search.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已受理的爬取参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrawlResponse {
    private String seedUrl;
    private Integer limit;
    private Double delaySeconds;
}
