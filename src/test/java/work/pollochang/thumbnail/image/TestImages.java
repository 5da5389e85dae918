package work.pollochang.thumbnail.image;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 測試用影像產生工具
 */
public final class TestImages {

    private TestImages() {}

    public static BufferedImage createTestImage(int width, int height, Color color) {
        return createTestImage(width, height, color, BufferedImage.TYPE_INT_RGB);
    }

    public static BufferedImage createTestImage(int width, int height, Color color, int imageType) {
        BufferedImage image = new BufferedImage(width, height, imageType);
        Graphics2D g = image.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * 左半部完全透明、右半部為不透明藍色的 ARGB 圖片
     */
    public static BufferedImage createHalfTransparentImage(int width, int height) {
        BufferedImage image = createTestImage(width, height, new Color(0, 0, 0, 0), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setPaint(Color.BLUE);
            g.fillRect(width / 2, 0, width - width / 2, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    public static Path writeImage(Path file, BufferedImage image, String format) throws IOException {
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("no ImageIO writer for " + format);
        }
        return file;
    }

    public static Path writeText(Path file, String content) throws IOException {
        return Files.writeString(file, content);
    }
}
