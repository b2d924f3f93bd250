package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import net.gridcollate.model.image.Fingerprint;
import net.gridcollate.util.image.ImageScaling;
import org.springframework.stereotype.Component;

/**
 * DCT-based perceptual hash (pHash).
 *
 * <p>The image is reduced to a {@value #SAMPLE_SIZE}x{@value #SAMPLE_SIZE} luma grid,
 * transformed with a 2-D DCT-II, and the top-left {@value #HASH_SIZE}x{@value #HASH_SIZE}
 * low-frequency block is thresholded against its median. Bits are packed row-major,
 * first coefficient in the most significant bit.</p>
 */
@Component
public class DctPerceptualHasher implements PerceptualHasher {

    static final int HASH_SIZE = 8;
    static final int SAMPLE_SIZE = HASH_SIZE * 4;

    private static final double[][] COSINES = cosineTable();

    @Override
    public Fingerprint hash(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("image is required");
        }
        double[][] luma = luma(ImageScaling.toRgb(image, SAMPLE_SIZE, SAMPLE_SIZE));

        // DCT along columns, keeping only the low-frequency rows
        double[][] columnPass = new double[HASH_SIZE][SAMPLE_SIZE];
        for (int k = 0; k < HASH_SIZE; k++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                double sum = 0.0;
                for (int y = 0; y < SAMPLE_SIZE; y++) {
                    sum += luma[y][x] * COSINES[k][y];
                }
                columnPass[k][x] = sum;
            }
        }

        double[] lowFrequencies = new double[HASH_SIZE * HASH_SIZE];
        for (int k = 0; k < HASH_SIZE; k++) {
            for (int l = 0; l < HASH_SIZE; l++) {
                double sum = 0.0;
                for (int x = 0; x < SAMPLE_SIZE; x++) {
                    sum += columnPass[k][x] * COSINES[l][x];
                }
                lowFrequencies[k * HASH_SIZE + l] = sum;
            }
        }

        double median = median(lowFrequencies);
        long bits = 0L;
        for (double coefficient : lowFrequencies) {
            bits = (bits << 1) | (coefficient > median ? 1L : 0L);
        }
        return new Fingerprint(bits);
    }

    private static double[][] luma(BufferedImage rgb) {
        double[][] values = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                int p = rgb.getRGB(x, y);
                int r = (p >> 16) & 0xFF;
                int g = (p >> 8) & 0xFF;
                int b = p & 0xFF;
                // ITU-R 601-2 luma
                values[y][x] = (r * 299 + g * 587 + b * 114) / 1000.0;
            }
        }
        return values;
    }

    private static double median(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    private static double[][] cosineTable() {
        double[][] table = new double[HASH_SIZE][SAMPLE_SIZE];
        for (int k = 0; k < HASH_SIZE; k++) {
            for (int n = 0; n < SAMPLE_SIZE; n++) {
                table[k][n] = Math.cos(Math.PI * k * (2 * n + 1) / (2.0 * SAMPLE_SIZE));
            }
        }
        return table;
    }
}
