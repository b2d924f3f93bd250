package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import net.gridcollate.model.image.Fingerprint;

/**
 * Produces a fixed-width fingerprint summarising an image's visual content.
 * Visually near-identical images should map to the same fingerprint.
 */
public interface PerceptualHasher {

    Fingerprint hash(BufferedImage image);
}
