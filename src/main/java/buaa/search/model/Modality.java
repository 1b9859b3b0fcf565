package buaa.search.model;

import buaa.search.common.convention.errorcode.SearchErrorCode;
import buaa.search.common.convention.exception.ClientException;

import java.util.Locale;

/**
 * 内容模态
 */
public enum Modality {

    TEXT("text"),
    IMAGE("image"),
    AUDIO("audio");

    private final String value;

    Modality(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 按外部取值（text/image/audio，大小写不敏感）解析模态
     *
     * @param value 外部取值
     * @return 对应模态
     */
    public static Modality fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Modality modality : values()) {
                if (modality.value.equals(normalized)) {
                    return modality;
                }
            }
        }
        throw new ClientException("未知的内容类型: " + value, SearchErrorCode.SEARCH_TYPE_NOT_SUPPORTED);
    }

    @Override
    public String toString() {
        return value;
    }
}
