package me.golemcore.bridge.adapter.outbound.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ImageCompressorTest {

    @TempDir
    Path tempDir;

    private final ImageCompressor compressor = new ImageCompressor();

    @Test
    void shouldKeepSmallImageUnchanged() throws IOException {
        Path file = writePng("small.png", 16, 16);
        byte[] original = Files.readAllBytes(file);

        ImageCompressor.EncodedImage result = compressor.compress(file, 500);

        assertArrayEquals(original, result.data());
        assertNotNull(result.mimeType());
    }

    @Test
    void shouldShrinkLargeImageUnderLimit() throws IOException {
        Path file = writePng("noise.png", 1200, 1200);
        assertTrue(Files.size(file) > 200 * 1024);

        ImageCompressor.EncodedImage result = compressor.compress(file, 200);

        assertTrue(result.data().length <= 200 * 1024);
        assertEquals("image/jpeg", result.mimeType());
        assertNotNull(ImageIO.read(new ByteArrayInputStream(result.data())));
    }

    @Test
    void shouldSkipCompressionWhenLimitDisabled() throws IOException {
        Path file = writePng("any.png", 400, 400);

        ImageCompressor.EncodedImage result = compressor.compress(file, 0);

        assertEquals(Files.size(file), result.data().length);
    }

    @Test
    void shouldRejectUnsupportedFormat() throws IOException {
        Path file = tempDir.resolve("note.bin");
        Files.write(file, new byte[2048]);

        assertThrows(IOException.class, () -> compressor.compress(file, 1));
    }

    private Path writePng(String name, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(42);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, random.nextInt(0xFFFFFF));
            }
        }
        Path file = tempDir.resolve(name);
        ImageIO.write(image, "png", file.toFile());
        return file;
    }
}
