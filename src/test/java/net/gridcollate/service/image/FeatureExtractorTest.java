package net.gridcollate.service.image;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.gridcollate.config.CollateProperties;
import net.gridcollate.exception.FeatureExtractionException;
import net.gridcollate.model.image.ExtractionResult;
import net.gridcollate.model.image.ExtractionStatus;
import net.gridcollate.model.image.ImageRecord;
import net.gridcollate.service.ledger.DuplicateLedger;
import net.gridcollate.service.ledger.LedgerCsvStore;
import net.gridcollate.testutil.TestImages;
import net.gridcollate.testutil.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FeatureExtractorTest {

    @TempDir
    Path tempDir;

    private CollateProperties properties;
    private FeatureExtractor extractor;
    private DuplicateLedger ledger;

    @BeforeEach
    void setUp() {
        properties = TestProperties.grid(tempDir, 2, 2);
        extractor = new FeatureExtractor(new ImageIoCodec(), new DctPerceptualHasher(), properties);
        ledger = DuplicateLedger.load(new LedgerCsvStore(tempDir.resolve("ledger.csv")));
    }

    @Test
    void should_ComputeFeatures_When_ImageIsSolidWhite() throws IOException {
        Path file = TestImages.writePng(tempDir, "white.png", TestImages.solid(Color.WHITE, 32, 32));

        ImageRecord record = extractor.analyze(file);

        assertThat(record.filename()).isEqualTo("white.png");
        assertThat(record.whiteness()).isEqualTo(1.0);
        assertThat(record.blackness()).isZero();
        assertThat(record.pixels()).isNotNull();
        assertThat(record.pixels().getWidth()).isEqualTo(TestProperties.CELL);
    }

    @Test
    void should_ResizeToCellSize_When_SourceIsLarger() throws IOException {
        Path file = TestImages.writePng(tempDir, "big.png", TestImages.blockNoise(21L, 128, 8));

        ImageRecord record = extractor.analyze(file);

        assertThat(record.pixels().getWidth()).isEqualTo(TestProperties.CELL);
        assertThat(record.pixels().getHeight()).isEqualTo(TestProperties.CELL);
    }

    @Test
    void should_ProduceIdenticalFeatures_When_SameFileAnalyzedTwice() throws IOException {
        Path file = TestImages.writePng(tempDir, "noise.png", TestImages.blockNoise(5L, 32, 8));

        ImageRecord first = extractor.analyze(file);
        ImageRecord second = extractor.analyze(file);

        assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(second.dominantColor()).containsExactly(first.dominantColor());
        assertThat(second.whiteness()).isEqualTo(first.whiteness());
        assertThat(second.blackness()).isEqualTo(first.blackness());
    }

    @Test
    void should_ReturnCandidateThenDuplicate_When_SameContentSeenTwice() throws IOException {
        Path a = TestImages.writePng(tempDir, "a.png", TestImages.blockNoise(9L, 32, 8));
        Path b = TestImages.writePng(tempDir, "b.png", TestImages.blockNoise(9L, 32, 8));

        ExtractionResult first = extractor.extract(a, ledger);
        ExtractionResult second = extractor.extract(b, ledger);

        assertThat(first.status()).isEqualTo(ExtractionStatus.CANDIDATE);
        assertThat(second.status()).isEqualTo(ExtractionStatus.DUPLICATE);
        assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(ledger.checkAndMark(first.fingerprint())).isTrue();
    }

    @Test
    void should_ReturnFailed_When_FileIsNotAnImage() throws IOException {
        Path corrupt = Files.writeString(tempDir.resolve("corrupt.png"), "definitely not a png");

        ExtractionResult result = extractor.extract(corrupt, ledger);

        assertThat(result.status()).isEqualTo(ExtractionStatus.FAILED);
        assertThat(result.filename()).isEqualTo("corrupt.png");
        assertThat(result.error()).contains("corrupt.png");
        assertThat(ledger.size()).isZero();
    }

    @Test
    void should_WrapCodecFailure_When_Analyzing() throws IOException {
        ImageCodec codec = mock(ImageCodec.class);
        when(codec.decode(any())).thenThrow(new IOException("disk gone"));
        FeatureExtractor failing = new FeatureExtractor(codec, new DctPerceptualHasher(), properties);

        assertThatThrownBy(() -> failing.analyze(tempDir.resolve("x.png")))
            .hasMessageContaining("disk gone")
            .isInstanceOfSatisfying(FeatureExtractionException.class,
                e -> assertThat(e.getImagePath()).isEqualTo(tempDir.resolve("x.png")));
    }

    @Test
    void should_StillHash_When_PreprocessingEnabled() throws IOException {
        properties.setPreprocess(true);
        Path file = TestImages.writePng(tempDir, "noise.png", TestImages.blockNoise(6L, 32, 8));

        ExtractionResult result = extractor.extract(file, ledger);

        assertThat(result.status()).isEqualTo(ExtractionStatus.CANDIDATE);
        assertThat(result.record().fingerprint()).isNotNull();
    }
}
