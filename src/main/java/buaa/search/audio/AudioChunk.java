package buaa.search.audio;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 定长音频分块
 */
@Getter
@AllArgsConstructor
public class AudioChunk {

    /** 分块采样，长度恒为 时长 × 采样率 */
    private final float[] samples;

    /** 起始秒（含） */
    private final int startSeconds;

    /** 结束秒（不含） */
    private final int endSeconds;

    /**
     * 是否整块静音（全部为 0）
     */
    public boolean isSilent() {
        for (float sample : samples) {
            if (sample != 0f) {
                return false;
            }
        }
        return true;
    }
}
