package net.gridcollate.testutil;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;
import javax.imageio.ImageIO;
import net.gridcollate.model.image.Fingerprint;
import net.gridcollate.model.image.ImageRecord;

/** Synthetic images and records for tests. */
public final class TestImages {
    private TestImages() {}

    public static BufferedImage solid(Color color, int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = color.getRGB();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    /**
     * Square image made of {@code blocks x blocks} tiles of random mid-range colours.
     * Different seeds give visually unrelated images with distinct fingerprints.
     */
    public static BufferedImage blockNoise(long seed, int size, int blocks) {
        Random random = new Random(seed);
        BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        int tile = size / blocks;
        for (int by = 0; by < blocks; by++) {
            for (int bx = 0; bx < blocks; bx++) {
                int rgb = new Color(20 + random.nextInt(180), 20 + random.nextInt(180), 20 + random.nextInt(180)).getRGB();
                for (int y = by * tile; y < (by + 1) * tile; y++) {
                    for (int x = bx * tile; x < (bx + 1) * tile; x++) {
                        img.setRGB(x, y, rgb);
                    }
                }
            }
        }
        return img;
    }

    public static Path writePng(Path dir, String fileName, BufferedImage image) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName);
        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG writer available");
        }
        return file;
    }

    /** Writes {@code count} distinct noise images named {@code prefix-00.png}, {@code prefix-01.png}, ... */
    public static void writeDistinctPngs(Path dir, String prefix, int count, long seedBase, int size) throws IOException {
        for (int i = 0; i < count; i++) {
            writePng(dir, String.format("%s-%02d.png", prefix, i), blockNoise(seedBase + i, size, 8));
        }
    }

    public static ImageRecord record(String filename, long bits, double whiteness, double blackness, double r, double g, double b) {
        return new ImageRecord(filename, new Fingerprint(bits), new double[] {r, g, b}, whiteness, blackness, null);
    }

    public static ImageRecord solidRecord(String filename, long bits, Color color, int size) {
        return new ImageRecord(filename, new Fingerprint(bits),
            new double[] {color.getRed(), color.getGreen(), color.getBlue()}, 0.0, 0.0, solid(color, size, size));
    }
}
