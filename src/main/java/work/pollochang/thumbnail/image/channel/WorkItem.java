package work.pollochang.thumbnail.image.channel;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 已完成轉換、等待儲存的縮圖。
 *
 * @param name  原始檔名 (含副檔名)
 * @param image 轉換後的 RGB 縮圖，放入佇列後由消費者獨佔
 */
public record WorkItem(String name, BufferedImage image) {

    public WorkItem {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(image, "image must not be null");
    }

    @Override
    public String toString() {
        return String.format("%s (%dx%d)", name, image.getWidth(), image.getHeight());
    }
}
