package work.pollochang.thumbnail.image.tools;

import java.awt.*;
import java.awt.image.BufferedImage;

public class ImageTools {

    private ImageTools() {}

    /**
     * 將圖片轉為不含 Alpha 的三通道 RGB 圖片。
     * <p>
     * 含 Alpha 的圖片 (包含有透明色的調色盤圖片) 會先鋪上同尺寸的白色底再合成；
     * 其他色彩模式 (灰階、調色盤、BGR 等) 直接轉成 {@link BufferedImage#TYPE_INT_RGB}。
     * 一律回傳新的圖片，不修改來源。
     *
     * @param source 來源圖片
     * @return 新的 {@link BufferedImage#TYPE_INT_RGB} 圖片
     */
    public static BufferedImage flattenToRgb(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();

        BufferedImage rgbImage = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = rgbImage.createGraphics();
        try {
            if (source.getColorModel().hasAlpha()) {
                g2d.setColor(Color.WHITE);
                g2d.fillRect(0, 0, width, height);
                g2d.setComposite(AlphaComposite.SrcOver);
            }
            g2d.drawImage(source, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rgbImage;
    }

    /**
     * 以漸進式雙三次插值將圖片縮小到指定尺寸。
     * <p>
     * 每一輪最多縮小一半，避免一次大幅縮小造成的鋸齒。
     * 目標尺寸不小於來源時直接回傳來源 (不放大)。
     *
     * @param originalImage 來源 RGB 圖片
     * @param targetWidth   目標寬度
     * @param targetHeight  目標高度
     * @return 縮小後的圖片
     */
    public static BufferedImage resizeImage(BufferedImage originalImage, int targetWidth, int targetHeight) {
        if (targetWidth >= originalImage.getWidth() && targetHeight >= originalImage.getHeight()) {
            return originalImage;
        }

        BufferedImage current = originalImage;
        int width = originalImage.getWidth();
        int height = originalImage.getHeight();

        do {
            width = Math.max(targetWidth, width / 2);
            height = Math.max(targetHeight, height / 2);

            BufferedImage step = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            Graphics2D g2d = step.createGraphics();
            try {
                // 使用更高品質的縮放演算法
                g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                g2d.drawImage(current, 0, 0, width, height, null);
            } finally {
                g2d.dispose();
            }

            if (current != originalImage) {
                current.flush();
            }
            current = step;
        } while (width != targetWidth || height != targetHeight);

        return current;
    }
}
