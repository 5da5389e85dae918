package work.pollochang.thumbnail.image.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

// 封裝解碼後的圖片、其讀取器與原始尺寸，方便資源管理
record DecodedImage(BufferedImage image, ImageReader reader, int sourceWidth, int sourceHeight) implements AutoCloseable {
    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
