package net.gridcollate.service.image;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.testutil.TestImages;
import net.gridcollate.testutil.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ImageIoSecondaryFormatExporterTest {

    @TempDir
    Path tempDir;

    private CollateProperties properties;
    private final BufferedImage canvas = TestImages.solid(Color.GREEN, 8, 8);

    @BeforeEach
    void setUp() {
        properties = TestProperties.grid(tempDir, 2, 2);
    }

    @Test
    void should_ReturnNull_When_SecondaryFormatBlank() {
        ImageIoSecondaryFormatExporter exporter = new ImageIoSecondaryFormatExporter(new ImageIoCodec(), properties);

        assertThat(exporter.export(canvas, tempDir.resolve("Cat-main-1.png"))).isNull();
    }

    @Test
    void should_WriteSiblingFile_When_WriterRegistered() {
        properties.setSecondaryFormat("BMP");
        ImageIoSecondaryFormatExporter exporter = new ImageIoSecondaryFormatExporter(new ImageIoCodec(), properties);

        Path written = exporter.export(canvas, tempDir.resolve("Cat-main-1.png"));

        assertThat(written).isEqualTo(tempDir.resolve("Cat-main-1.bmp"));
        assertThat(written).exists();
    }

    @Test
    void should_ReturnNullWithoutFile_When_NoWriterForFormat() {
        properties.setSecondaryFormat("dds");
        ImageIoSecondaryFormatExporter exporter = new ImageIoSecondaryFormatExporter(new ImageIoCodec(), properties);

        Path written = exporter.export(canvas, tempDir.resolve("Cat-main-1.png"));

        assertThat(written).isNull();
        assertThat(tempDir.resolve("Cat-main-1.dds")).doesNotExist();
    }

    @Test
    void should_ReturnNull_When_WriteFails() throws IOException {
        properties.setSecondaryFormat("bmp");
        ImageCodec codec = mock(ImageCodec.class);
        when(codec.canEncode("bmp")).thenReturn(true);
        doThrow(new IOException("disk full")).when(codec).encode(any(), anyString(), eq(tempDir.resolve("Cat-main-1.bmp")));
        ImageIoSecondaryFormatExporter exporter = new ImageIoSecondaryFormatExporter(codec, properties);

        assertThat(exporter.export(canvas, tempDir.resolve("Cat-main-1.png"))).isNull();
    }

    @Test
    void should_SwapExtension_When_BuildingSiblingPath() {
        assertThat(ImageIoSecondaryFormatExporter.siblingWithExtension(Path.of("out", "a.b-1.png"), "dds"))
            .isEqualTo(Path.of("out", "a.b-1.dds"));
        assertThat(ImageIoSecondaryFormatExporter.siblingWithExtension(Path.of("out", "noext"), "dds"))
            .isEqualTo(Path.of("out", "noext.dds"));
    }
}
