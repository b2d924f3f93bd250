package net.gridcollate.service.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}.
 *
 * <p>Writes go to a sibling temp file that is moved into place, so a crashed write
 * never leaves a truncated grid image under its final name.</p>
 */
@Service
public class ImageIoCodec implements ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoCodec.class);
    private static final String TEMP_SUFFIX = ".part";

    @Override
    public BufferedImage decode(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new IOException("Unsupported or corrupt image: " + file.getFileName());
            }
            return image;
        }
    }

    @Override
    public void encode(BufferedImage image, String format, Path target) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer registered for format '" + format + "'");
        }
        ImageWriter writer = writers.next();
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(temp);
                 ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, null), writer.getDefaultWriteParam());
            }
            moveIntoPlace(temp, target);
            logger.debug("Wrote {} image {} ({}x{}).", format, target, image.getWidth(), image.getHeight());
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        } finally {
            writer.dispose();
        }
    }

    @Override
    public boolean canEncode(String format) {
        return format != null && ImageIO.getImageWritersByFormatName(format).hasNext();
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
