package com.expensesnap.core.infrastructure.imaging;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.NormalizedDocument;
import com.expensesnap.core.domain.NormalizedImage;
import com.expensesnap.core.exception.ConversionFailedException;
import com.expensesnap.core.exception.DocumentUnreadableException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxDocumentNormalizerTest {

    private AppProperties props;
    private PdfBoxDocumentNormalizer normalizer;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        // 36 dpi is half of PDF user space, so a 200pt wide page renders 100px wide
        props.getNormalizer().setPdfDpi(36);
        normalizer = new PdfBoxDocumentNormalizer(props);
    }

    private static byte[] pdfWithPageWidths(int... widths) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (int w : widths) {
                doc.addPage(new PDPage(new PDRectangle(w, 300)));
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    private static BufferedImage read(byte[] bytes) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(bytes));
    }

    private static byte[] noisyPng(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Random random = new Random(42);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, random.nextInt(0xFFFFFF));
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    void rendersEveryPdfPageInOrderWithFirstPageAsPreview() throws IOException {
        NormalizedDocument doc = normalizer.normalize(pdfWithPageWidths(200, 300, 400, 500), "invoice.PDF");

        assertThat(doc.pageCount()).isEqualTo(4);
        assertThat(doc.pages()).extracting(NormalizedImage::mediaType).containsOnly("image/png");
        int[] widths = new int[4];
        for (int i = 0; i < 4; i++) {
            widths[i] = read(doc.pages().get(i).bytes()).getWidth();
        }
        assertThat(widths).containsExactly(100, 150, 200, 250);
        assertThat(doc.previewBytes()).isEqualTo(doc.pages().get(0).bytes());
        assertThat(doc.previewExtension()).isEqualTo(".png");
    }

    @Test
    void pdfPagesBeyondTheLimitAreSkipped() throws IOException {
        props.getNormalizer().setPdfMaxPages(2);

        NormalizedDocument doc = normalizer.normalize(pdfWithPageWidths(200, 300, 400), "long.pdf");

        assertThat(doc.pageCount()).isEqualTo(2);
    }

    @Test
    void unreadablePdfIsRejected() {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> normalizer.normalize(garbage, "broken.pdf"))
                .isInstanceOf(DocumentUnreadableException.class)
                .hasMessageStartingWith("Failed to read PDF");
    }

    @Test
    void heicWithoutWorkingConverterFailsConversion() {
        props.getNormalizer().setHeicCommand(List.of("expensesnap-no-such-heif-tool", "{input}", "{output}"));
        byte[] heic = "....ftypheic not decodable here".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> normalizer.normalize(heic, "photo.heic"))
                .isInstanceOf(ConversionFailedException.class)
                .hasMessageStartingWith("Failed to convert HEIC");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void heicIsDecodedByConverterAndReencodedAsJpeg(@TempDir Path dir) throws IOException {
        // stands in for heif-convert: writes a decoded 64x48 image to the output path
        Path decoded = dir.resolve("decoded.png");
        Files.write(decoded, noisyPng(64, 48));
        props.getNormalizer().setHeicCommand(List.of("cp", decoded.toString(), "{output}"));
        byte[] heic = "....ftypheic not decodable here".getBytes(StandardCharsets.UTF_8);

        NormalizedDocument doc = normalizer.normalize(heic, "IMG_0042.HEIC");

        NormalizedImage page = doc.pages().get(0);
        assertThat(page.mediaType()).isEqualTo("image/jpeg");
        assertThat(doc.previewExtension()).isEqualTo(".jpg");
        assertThat(doc.previewBytes()).isEqualTo(page.bytes());
        assertThat(page.bytes()[0]).isEqualTo((byte) 0xFF);
        assertThat(page.bytes()[1]).isEqualTo((byte) 0xD8);
        BufferedImage image = read(page.bytes());
        assertThat(image.getWidth()).isEqualTo(64);
        assertThat(image.getHeight()).isEqualTo(48);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hangingConverterIsKilledAfterTimeout() {
        props.getNormalizer().setHeicCommand(List.of("sleep", "10"));
        props.getNormalizer().setHeicTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> normalizer.normalize(new byte[]{0, 1, 2}, "photo.heif"))
                .isInstanceOf(ConversionFailedException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void converterCommandSubstitutesTempPaths() throws IOException {
        props.getNormalizer().setHeicCommand(List.of("heif-convert", "-q", "90", "{input}", "{output}"));

        List<String> command = new ExternalHeifConverter(props.getNormalizer())
                .commandFor(Path.of("/tmp/in.heic"), Path.of("/tmp/out.jpg"));

        assertThat(command).containsExactly("heif-convert", "-q", "90", "/tmp/in.heic", "/tmp/out.jpg");
    }

    @Test
    void smallImagesPassThroughUntouched() throws IOException {
        byte[] png = noisyPng(40, 30);

        NormalizedDocument doc = normalizer.normalize(png, "receipt.png");

        assertThat(doc.pages().get(0).bytes()).isSameAs(png);
        assertThat(doc.pages().get(0).mediaType()).isEqualTo("image/png");
        assertThat(doc.previewExtension()).isEqualTo(".png");
    }

    @Test
    void largeImagesAreDownscaledToJpeg() throws IOException {
        props.getNormalizer().setCompressThresholdBytes(1000);
        props.getNormalizer().setMaxDimension(120);
        byte[] png = noisyPng(400, 200);

        NormalizedDocument doc = normalizer.normalize(png, "big.png");

        NormalizedImage page = doc.pages().get(0);
        assertThat(page.mediaType()).isEqualTo("image/jpeg");
        assertThat(doc.previewExtension()).isEqualTo(".jpg");
        BufferedImage scaled = read(page.bytes());
        assertThat(scaled.getWidth()).isEqualTo(120);
        assertThat(scaled.getHeight()).isEqualTo(60);
    }

    @Test
    void undecodableLargeImageIsSentAsIs() {
        props.getNormalizer().setCompressThresholdBytes(10);
        byte[] blob = "opaque bytes that no reader understands".getBytes(StandardCharsets.UTF_8);

        NormalizedDocument doc = normalizer.normalize(blob, "scan.webp");

        assertThat(doc.pages().get(0).bytes()).isSameAs(blob);
        assertThat(doc.pages().get(0).mediaType()).isEqualTo("image/webp");
    }

    @Test
    void unknownExtensionIsTreatedAsJpeg() {
        assertThat(PdfBoxDocumentNormalizer.mediaTypeFor(PdfBoxDocumentNormalizer.extensionOf("receipt.xyz")))
                .isEqualTo("image/jpeg");
        assertThat(PdfBoxDocumentNormalizer.extensionOf("no-extension")).isEmpty();
        assertThat(PdfBoxDocumentNormalizer.extensionOf("dir.v2/file")).isEmpty();
        assertThat(PdfBoxDocumentNormalizer.mediaTypeFor(".heif")).isEqualTo("image/heic");
    }
}
