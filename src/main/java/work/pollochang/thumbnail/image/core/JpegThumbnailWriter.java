package work.pollochang.thumbnail.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.thumbnail.image.channel.WorkItem;
import work.pollochang.thumbnail.image.report.SaveReport;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 以固定 JPEG 格式將縮圖寫入輸出目錄。
 *
 * <p>縮圖先編碼到記憶體中的 {@link ByteArrayOutputStream}，再一次性寫入檔案，
 * 編碼失敗時不會在輸出目錄留下不完整的檔案。</p>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class JpegThumbnailWriter implements ThumbnailWriter {

    private final float quality;

    /**
     * @param quality 壓縮品質，數值範圍為 0.0f（最低品質，最大壓縮）到 1.0f（最高品質，最小壓縮）。
     */
    public JpegThumbnailWriter(float quality) {
        if (quality < 0.0f || quality > 1.0f) {
            throw new IllegalArgumentException("quality must be between 0.0 and 1.0: " + quality);
        }
        this.quality = quality;
    }

    @Override
    public SaveReport write(WorkItem item, Path outputDir) {
        Path outputFile = outputDir.resolve(ThumbnailNaming.thumbnailName(item.name()));

        byte[] encoded;
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            compressJpgToStream(item.image(), bos, quality);
            encoded = bos.toByteArray();
        } catch (IOException | RuntimeException e) {
            log.debug("{} - JPEG 編碼失敗", item.name(), e);
            return SaveReport.failed(ProcessResult.FAILED_ENCODE, outputFile, e.toString());
        }

        try {
            Files.write(outputFile, encoded);
            return SaveReport.saved(outputFile, encoded.length);
        } catch (IOException e) {
            log.debug("{} - 寫入 {} 失敗", item.name(), outputFile, e);
            return SaveReport.failed(ProcessResult.FAILED_IO_ERROR, outputFile, e.toString());
        }
    }

    /**
     * 將指定的 {@link BufferedImage} 圖像以指定的壓縮品質轉換為 JPEG 格式，
     * 並寫入至指定的 {@link OutputStream} 輸出串流。
     *
     * @param image   要壓縮的圖片，必須為不含 Alpha 的 RGB 圖片。
     * @param os      輸出串流，用來接收 JPEG 壓縮後的影像資料。
     * @param quality 壓縮品質
     * @throws IOException 如果在建立輸出串流或圖像寫入過程中發生 I/O 錯誤，或找不到 JPEG 編碼器。
     */
    private static void compressJpgToStream(BufferedImage image, OutputStream os, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new IOException("找不到 JPEG 編碼器");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(os)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
