package buaa.search.common.convention.errorcode;

/**
 * 搜索引擎错误码枚举
 *
 * 错误码规范：
 * - 0: 成功
 * - A0xxx: 客户端错误（参数校验、内容格式等）
 * - B0xxx: 服务端错误（业务逻辑、数据库等）
 * - C0xxx: 外部依赖错误（第三方服务）
 */
public enum SearchErrorCode implements IErrorCode {

    // ==================== 通用错误 ====================
    SUCCESS("0", "操作成功"),

    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    /**
     * 必填参数为空
     */
    PARAM_EMPTY("A0101", "必填参数为空"),

    /**
     * 参数格式错误
     */
    PARAM_INVALID("A0102", "参数格式错误"),

    /**
     * 搜索关键词不能为空
     */
    QUERY_EMPTY("A0104", "搜索关键词不能为空"),

    /**
     * 返回数量超出范围
     */
    LIMIT_OUT_OF_RANGE("A0106", "返回数量超出允许范围"),

    /**
     * 不支持的搜索类型
     */
    SEARCH_TYPE_NOT_SUPPORTED("A0107", "不支持的搜索类型"),

    /**
     * 起始地址不合法
     */
    SEED_URL_INVALID("A0108", "起始地址必须是 http(s) 绝对地址"),

    // ==================== 内容格式错误 (A02xx) ====================
    /**
     * 图片无法解码
     */
    IMAGE_DECODE_FAILED("A0203", "图片文件无效或已损坏"),

    /**
     * 音频无法解码
     */
    AUDIO_DECODE_FAILED("A0204", "音频文件无效或已损坏"),

    /**
     * 文件大小超出限制
     */
    FILE_SIZE_EXCEEDED("A0205", "文件大小超出限制"),

    /**
     * 向量维度与模型配置不一致
     */
    EMBEDDING_DIMENSION_MISMATCH("A0301", "向量维度与配置不一致"),

    // ==================== 服务端错误 (B0xxx) ====================
    SEARCH_SERVICE_ERROR("B0102", "搜索服务异常"),

    EMBEDDING_SERVICE_ERROR("B0103", "向量化服务异常"),

    // ==================== 外部依赖错误 (C0xxx) ====================
    ELASTICSEARCH_ERROR("C0101", "Elasticsearch服务异常"),

    ASSET_DOWNLOAD_FAILED("C0102", "资源下载失败"),

    EMBEDDING_API_ERROR("C0104", "向量化API异常");

    private final String code;
    private final String message;

    SearchErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
