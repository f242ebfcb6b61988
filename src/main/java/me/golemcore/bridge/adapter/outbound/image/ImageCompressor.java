/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bridge.adapter.outbound.image;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Shrinks images to an upload size limit for vision requests. Images within the
 * limit are sent unchanged; larger ones are re-encoded as JPEG with decreasing
 * quality, then downscaled until they fit.
 */
@Component
@Slf4j
public class ImageCompressor {

    private static final float[] QUALITY_STEPS = { 0.85f, 0.7f, 0.55f, 0.4f };
    private static final double SCALE_STEP = 0.75;
    private static final int MIN_DIMENSION = 256;
    private static final String JPEG = "image/jpeg";

    public record EncodedImage(byte[] data, String mimeType) {
    }

    /**
     * Reads the image and fits it under {@code maxKb} kilobytes.
     *
     * @throws IOException
     *             if the file cannot be read or is not a supported image
     */
    public EncodedImage compress(Path file, int maxKb) throws IOException {
        byte[] original = Files.readAllBytes(file);
        long limit = maxKb * 1024L;
        String mimeType = Files.probeContentType(file);
        if (maxKb <= 0 || original.length <= limit) {
            return new EncodedImage(original, mimeType != null ? mimeType : JPEG);
        }

        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + file.getFileName());
        }
        BufferedImage rgb = toRgb(image);

        byte[] encoded = null;
        for (float quality : QUALITY_STEPS) {
            encoded = encodeJpeg(rgb, quality);
            if (encoded.length <= limit) {
                log.debug("[Image] {} compressed {} -> {} bytes at quality {}", file.getFileName(),
                        original.length, encoded.length, quality);
                return new EncodedImage(encoded, JPEG);
            }
        }

        BufferedImage scaled = rgb;
        float lowest = QUALITY_STEPS[QUALITY_STEPS.length - 1];
        while (Math.min(scaled.getWidth(), scaled.getHeight()) * SCALE_STEP >= MIN_DIMENSION) {
            scaled = scale(scaled, SCALE_STEP);
            encoded = encodeJpeg(scaled, lowest);
            if (encoded.length <= limit) {
                break;
            }
        }
        log.debug("[Image] {} downscaled to {}x{}, {} bytes", file.getFileName(), scaled.getWidth(),
                scaled.getHeight(), encoded.length);
        return new EncodedImage(encoded, JPEG);
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, java.awt.Color.WHITE, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private static BufferedImage scale(BufferedImage image, double factor) {
        int width = Math.max(1, (int) Math.round(image.getWidth() * factor));
        int height = Math.max(1, (int) Math.round(image.getHeight() * factor));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(image, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output)) {
            writer.setOutput(stream);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
