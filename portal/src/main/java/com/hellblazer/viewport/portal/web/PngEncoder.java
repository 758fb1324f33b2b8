package com.hellblazer.viewport.portal.web;

import com.hellblazer.viewport.queue.ImageBuffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encodes rendered frames as PNG for transport.
 */
public final class PngEncoder {

    private PngEncoder() {
        // Utility class - no instantiation
    }

    public static byte[] encode(ImageBuffer image) throws IOException {
        var buffered = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < image.height(); y++) {
            for (int x = 0; x < image.width(); x++) {
                buffered.setRGB(x, y, image.rgbAt(x, y));
            }
        }
        var out = new ByteArrayOutputStream();
        if (!ImageIO.write(buffered, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }
}
