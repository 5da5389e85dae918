package work.pollochang.thumbnail.image.core;

/**
 * 縮圖外框尺寸 (寬 x 高)。
 */
public record ThumbnailSize(int width, int height) {

    public static final ThumbnailSize DEFAULT = new ThumbnailSize(200, 200);

    public ThumbnailSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("thumbnail size must be positive: " + width + "x" + height);
        }
    }

    /**
     * 計算來源尺寸等比例放入外框後的尺寸，不放大。
     * 受限的一邊會剛好等於外框邊長。
     *
     * @param sourceWidth  來源寬度
     * @param sourceHeight 來源高度
     * @return 縮放後尺寸；來源已小於外框時回傳原尺寸
     */
    public ThumbnailSize fit(int sourceWidth, int sourceHeight) {
        if (sourceWidth <= width && sourceHeight <= height) {
            return new ThumbnailSize(sourceWidth, sourceHeight);
        }
        double widthRatio = (double) width / sourceWidth;
        double heightRatio = (double) height / sourceHeight;

        if (widthRatio <= heightRatio) {
            int scaledHeight = (int) Math.max(1, Math.round(sourceHeight * widthRatio));
            return new ThumbnailSize(width, Math.min(height, scaledHeight));
        }
        int scaledWidth = (int) Math.max(1, Math.round(sourceWidth * heightRatio));
        return new ThumbnailSize(Math.min(width, scaledWidth), height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
