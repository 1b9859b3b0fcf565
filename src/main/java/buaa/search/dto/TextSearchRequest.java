package buaa.search.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 文本检索请求
 */
@Data
public class TextSearchRequest {

    @NotBlank(message = "查询内容不能为空")
    @Size(max = 200, message = "查询内容不能超过200个字符")
    private String q;

    /** 目标模态：text / image / audio */
    private String type = "text";

    @NotNull(message = "返回数量不能为空")
    @Min(value = 1, message = "返回数量至少为1")
    @Max(value = 50, message = "返回数量不能超过50")
    private Integer limit = 10;
}
