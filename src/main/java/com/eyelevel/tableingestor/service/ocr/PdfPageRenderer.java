package com.eyelevel.tableingestor.service.ocr;

import com.eyelevel.tableingestor.config.IngestionConfig;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Renders PDF pages to grayscale PNG images for OCR. A {@link PDDocument} is not thread-safe, so
 * callers render pages of one document sequentially.
 */
@Component
@RequiredArgsConstructor
public class PdfPageRenderer {

    private final IngestionConfig config;

    public PDFRenderer rendererFor(PDDocument document) {
        return new PDFRenderer(document);
    }

    /**
     * @param pageIndex 0-based page index.
     */
    public byte[] renderPage(PDFRenderer renderer, int pageIndex) throws IOException {
        BufferedImage image = renderer.renderImageWithDPI(pageIndex, config.getOcr().getDpi(), ImageType.GRAY);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }
}
