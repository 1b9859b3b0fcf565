package buaa.search.repository;

import buaa.search.model.AudioFeature;
import buaa.search.model.ImageFeature;
import buaa.search.model.TextFeature;

/**
 * 按模态分组的特征存储
 */
public class FeatureStores {

    private final FeatureStore<TextFeature> text;
    private final FeatureStore<ImageFeature> image;
    private final FeatureStore<AudioFeature> audio;

    public FeatureStores(FeatureStore<TextFeature> text,
                         FeatureStore<ImageFeature> image,
                         FeatureStore<AudioFeature> audio) {
        this.text = text;
        this.image = image;
        this.audio = audio;
    }

    public FeatureStore<TextFeature> text() {
        return text;
    }

    public FeatureStore<ImageFeature> image() {
        return image;
    }

    public FeatureStore<AudioFeature> audio() {
        return audio;
    }
}
