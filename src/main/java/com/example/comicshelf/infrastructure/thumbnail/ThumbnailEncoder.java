package com.example.comicshelf.infrastructure.thumbnail;

import com.example.comicshelf.common.config.AppThumbnailProperties;
import com.example.comicshelf.domain.enumtype.ThumbnailFormat;
import com.example.comicshelf.domain.model.EncodedThumbnail;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ThumbnailEncoder {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailEncoder.class);

    private static final int PLACEHOLDER_WIDTH = 300;
    private static final int PLACEHOLDER_HEIGHT = 450;

    private final AppThumbnailProperties appThumbnailProperties;
    private final AtomicBoolean fallbackLogged = new AtomicBoolean(false);

    public ThumbnailEncoder(AppThumbnailProperties appThumbnailProperties) {
        this.appThumbnailProperties = appThumbnailProperties;
    }

    /**
     * Decodes a cover image and encodes it at the configured bound, format and quality.
     *
     * @throws IOException when the data is not a decodable image
     */
    public EncodedThumbnail encode(InputStream imageData) throws IOException {
        BufferedImage source = ImageIO.read(imageData);
        if (source == null) {
            throw new IOException("Unsupported or corrupt image data");
        }
        BufferedImage scaled = scaleToBound(source,
                appThumbnailProperties.getWidth(), appThumbnailProperties.getHeight());
        return encode(scaled, ThumbnailFormat.fromSetting(appThumbnailProperties.getFormat()));
    }

    EncodedThumbnail encode(BufferedImage image, ThumbnailFormat requested) throws IOException {
        float quality = clampQuality(appThumbnailProperties.getQuality());
        if (requested == ThumbnailFormat.BEST) {
            byte[] jpeg = write(image, ThumbnailFormat.JPEG, quality);
            byte[] png = write(image, ThumbnailFormat.PNG, quality);
            if (png.length < jpeg.length) {
                return new EncodedThumbnail(png, ThumbnailFormat.PNG, jpeg.length - png.length);
            }
            return new EncodedThumbnail(jpeg, ThumbnailFormat.JPEG, png.length - jpeg.length);
        }
        ThumbnailFormat effective = requested;
        if (!hasWriter(requested)) {
            if (fallbackLogged.compareAndSet(false, true)) {
                log.warn("THUMBNAIL_WRITER_MISSING format={} fallback=jpeg", requested.getWriterName());
            }
            effective = ThumbnailFormat.JPEG;
        }
        return new EncodedThumbnail(write(image, effective, quality), effective, 0L);
    }

    /**
     * Gray "Generating..." card served while a cover is still being extracted.
     */
    public byte[] placeholderPng() {
        BufferedImage image = new BufferedImage(PLACEHOLDER_WIDTH, PLACEHOLDER_HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(new Color(0x44, 0x44, 0x44));
            g.fillRect(0, 0, PLACEHOLDER_WIDTH, PLACEHOLDER_HEIGHT);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(new Color(0xBB, 0xBB, 0xBB));
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 22));
            String label = "Generating...";
            FontMetrics metrics = g.getFontMetrics();
            int x = (PLACEHOLDER_WIDTH - metrics.stringWidth(label)) / 2;
            int y = PLACEHOLDER_HEIGHT / 2 + metrics.getAscent() / 2;
            g.drawString(label, x, y);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new ThumbnailWriteException("Failed to render placeholder", e);
        }
        return out.toByteArray();
    }

    /**
     * Fits the image inside the bound keeping its aspect ratio. Never upscales. The result is always
     * opaque RGB so alpha and palette sources encode cleanly as jpeg.
     */
    static BufferedImage scaleToBound(BufferedImage source, int maxWidth, int maxHeight) {
        int srcWidth = source.getWidth();
        int srcHeight = source.getHeight();
        double ratio = Math.min(1.0d, Math.min((double) maxWidth / srcWidth, (double) maxHeight / srcHeight));
        int width = Math.max(1, (int) Math.round(srcWidth * ratio));
        int height = Math.max(1, (int) Math.round(srcHeight * ratio));

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    private boolean hasWriter(ThumbnailFormat format) {
        return format.getWriterName() != null
                && ImageIO.getImageWritersByFormatName(format.getWriterName()).hasNext();
    }

    private byte[] write(BufferedImage image, ThumbnailFormat format, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getWriterName());
        if (!writers.hasNext()) {
            throw new ThumbnailWriteException("No image writer for " + format.getWriterName());
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] types = param.getCompressionTypes();
                if (types != null && types.length > 0 && param.getCompressionType() == null) {
                    param.setCompressionType(types[0]);
                }
                param.setCompressionQuality(quality);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    private float clampQuality(int quality) {
        int q = Math.max(1, Math.min(100, quality));
        return q / 100f;
    }
}
