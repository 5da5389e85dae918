package work.pollochang.thumbnail.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.report.TransformReport;
import work.pollochang.thumbnail.image.tools.ImageTools;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * 縮圖轉換: 解碼、轉為白底 RGB、等比例縮小至外框內。
 * <p>
 * 只讀取來源檔案，不會修改它。回傳的圖片由呼叫端獨佔。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ThumbnailTransformer implements ImageTransformer {

    // 解碼時至少保留外框的倍數，再交給高品質縮放處理
    private static final int SUBSAMPLING_HEADROOM = 4;

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    @Override
    public TransformReport transform(Path file, ThumbnailSize size) {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(size, "size must not be null");

        try (DecodedImage decodedImage = decodeImageWithSubsampling(file, size)) {
            if (decodedImage == null) {
                return TransformReport.failed(ProcessResult.FAILED_UNSUPPORTED_FORMAT, "找不到對應的圖片讀取器");
            }

            ThumbnailSize target = size.fit(decodedImage.sourceWidth(), decodedImage.sourceHeight());
            BufferedImage rgbImage = ImageTools.flattenToRgb(decodedImage.image());
            BufferedImage thumbnail = ImageTools.resizeImage(rgbImage, target.width(), target.height());
            if (thumbnail != rgbImage) {
                rgbImage.flush();
            }

            log.debug("{} - 縮圖 {}x{} -> {}", file.getFileName(),
                    decodedImage.sourceWidth(), decodedImage.sourceHeight(), target);
            return TransformReport.transformed(thumbnail);
        } catch (IOException e) {
            log.debug("{} - 解碼時發生 I/O 錯誤", file, e);
            return TransformReport.failed(ProcessResult.FAILED_DECODE, e.getMessage());
        } catch (RuntimeException e) {
            // ImageIO 外掛遇到損毀的檔案時可能拋出 IllegalArgumentException 等執行期例外
            log.debug("{} - 解碼器無法處理檔案內容", file, e);
            return TransformReport.failed(ProcessResult.FAILED_DECODE, e.toString());
        }
    }

    private DecodedImage decodeImageWithSubsampling(Path inputPath, ThumbnailSize size) throws IOException {
        try (InputStream fileIn = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(fileIn)) {
            if (in == null) {
                log.debug("{} - 無法建立圖片輸入流", inputPath);
                return null;
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                log.debug("{} - 找不到對應的圖片讀取器", inputPath);
                return null;
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                // 核心優化：計算取樣率以降低記憶體使用，但仍保留外框數倍的解析度
                int subsampling = 1;
                int ratio = Math.min(width / size.width(), height / size.height()) / SUBSAMPLING_HEADROOM;
                if (ratio > 1) {
                    // 確保取樣率是 2 的冪，對某些 JPG 解碼器更友好
                    subsampling = Integer.highestOneBit(ratio);
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                // 注意：此時返回的 reader 不能關閉，因為 DecodedImage 的 AutoCloseable 會負責關閉
                return new DecodedImage(image, reader, width, height);

            } catch (IOException | RuntimeException e) {
                // 如果在讀取尺寸或解碼時出錯，安全地釋放 reader
                reader.dispose();
                throw e; // 重新拋出異常，讓外層捕捉
            }
        }
    }
}
