/**
 * ImageDownscaler.java
 *
 * 该工具类负责在发送图片产物之前对其进行预处理：
 * 超出边长上限的图片按比例缩小，然后统一重新编码为 PNG。
 * 当缩放功能被关闭或图片格式无法识别时，原样返回文件字节。
 */
package club.ppmc.runner.util;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ImageDownscaler {

    private static final String OUTPUT_FORMAT = "png";

    private final int maxDimension;
    private final boolean enabled;

    public ImageDownscaler(int maxDimension, boolean enabled) {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive: " + maxDimension);
        }
        this.maxDimension = maxDimension;
        this.enabled = enabled;
    }

    /**
     * 读取图片文件并返回待发送的字节。
     *
     * @param path 图片文件路径。
     * @return 缩放并重新编码后的 PNG 字节，或在无法处理时返回原始字节。
     * @throws IOException 如果文件读取或编码失败。
     */
    public byte[] prepare(Path path) throws IOException {
        byte[] original = Files.readAllBytes(path);
        if (!enabled) {
            return original;
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(original));
        if (image == null) {
            log.debug("没有可用的图片解码器处理 {}，将发送原始字节。", path);
            return original;
        }

        BufferedImage result = exceedsBound(image) ? scaleDown(image) : image;
        var out = new ByteArrayOutputStream();
        if (!ImageIO.write(result, OUTPUT_FORMAT, out)) {
            log.debug("没有可用的 PNG 编码器处理 {}，将发送原始字节。", path);
            return original;
        }
        return out.toByteArray();
    }

    private boolean exceedsBound(BufferedImage image) {
        return image.getWidth() > maxDimension || image.getHeight() > maxDimension;
    }

    private BufferedImage scaleDown(BufferedImage image) {
        double scale = Math.min(
                (double) maxDimension / image.getWidth(), (double) maxDimension / image.getHeight());
        int width = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(image.getHeight() * scale));
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        var scaled = new BufferedImage(width, height, type);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }
}
