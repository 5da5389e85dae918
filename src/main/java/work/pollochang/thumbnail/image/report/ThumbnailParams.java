package work.pollochang.thumbnail.image.report;

import work.pollochang.thumbnail.image.core.ThumbnailSize;

import java.util.Objects;

/**
 * 縮圖參數
 *
 * @param size            縮圖外框尺寸
 * @param quality         JPEG 壓縮品質 (0.0 ~ 1.0)
 * @param channelCapacity 交換佇列容量，0 表示不限制
 */
public record ThumbnailParams(ThumbnailSize size, float quality, int channelCapacity) {

    public static final float DEFAULT_QUALITY = 0.75f;
    public static final int DEFAULT_CHANNEL_CAPACITY = 16;

    public ThumbnailParams {
        Objects.requireNonNull(size, "size must not be null");
        if (quality < 0.0f || quality > 1.0f) {
            throw new IllegalArgumentException("quality must be between 0.0 and 1.0: " + quality);
        }
        if (channelCapacity < 0) {
            throw new IllegalArgumentException("channelCapacity must not be negative: " + channelCapacity);
        }
    }

    public static ThumbnailParams defaults() {
        return new ThumbnailParams(ThumbnailSize.DEFAULT, DEFAULT_QUALITY, DEFAULT_CHANNEL_CAPACITY);
    }
}
