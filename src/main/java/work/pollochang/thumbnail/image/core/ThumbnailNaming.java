package work.pollochang.thumbnail.image.core;

/**
 * 縮圖檔名規則: {@code <原始檔名去副檔名>-thumbnail.jpg}
 */
public final class ThumbnailNaming {

    public static final String SUFFIX = "-thumbnail";
    public static final String EXTENSION = ".jpg";

    private ThumbnailNaming() {}

    /**
     * 由原始檔名產生縮圖檔名。只移除最後一個副檔名，開頭的點不視為副檔名 (例如 {@code .hidden})。
     *
     * @param originalName 原始檔名 (含副檔名)
     * @return 縮圖檔名
     */
    public static String thumbnailName(String originalName) {
        return baseName(originalName) + SUFFIX + EXTENSION;
    }

    public static boolean isThumbnailName(String fileName) {
        return fileName.endsWith(SUFFIX + EXTENSION);
    }

    static String baseName(String fileName) {
        int leadingDots = 0;
        while (leadingDots < fileName.length() && fileName.charAt(leadingDots) == '.') {
            leadingDots++;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < leadingDots) {
            return fileName;
        }
        return fileName.substring(0, dot);
    }
}
