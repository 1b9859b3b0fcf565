package buaa.search.dto;

import buaa.search.model.AudioFeature;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 音频分块检索结果，给出命中分块在原音频中的起止秒
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AudioResult implements SearchResultItem {

    @JsonProperty("source_page_url")
    private String sourcePageUrl;

    @JsonProperty("asset_url")
    private String assetUrl;

    @JsonProperty("begin_stamp_seconds")
    private Integer beginStampSeconds;

    @JsonProperty("end_stamp_seconds")
    private Integer endStampSeconds;

    public static AudioResult from(AudioFeature feature) {
        return new AudioResult(feature.getSourcePageUrl(), feature.getAssetUrl(),
            feature.getBeginStampSeconds(), feature.getEndStampSeconds());
    }
}
