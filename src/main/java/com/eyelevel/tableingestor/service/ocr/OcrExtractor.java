package com.eyelevel.tableingestor.service.ocr;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.EmptyContentException;
import com.eyelevel.tableingestor.exception.OcrExtractionException;
import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.ExtractedDocument;
import com.eyelevel.tableingestor.model.ExtractedPage;
import com.eyelevel.tableingestor.model.JobIssue;
import com.eyelevel.tableingestor.model.Kind;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Turns images and PDFs into an {@link ExtractedDocument}.
 * <p>
 * PDF pages are rendered one after another and recognized concurrently, at most
 * {@code page-concurrency} pages per document at a time. A page that cannot be rendered or
 * recognized keeps its slot with {@code ok=false} and empty text; the document only fails when the
 * share of good pages drops below {@code min-success-ratio}.
 */
@Slf4j
@Service
public class OcrExtractor {

    private final IngestionConfig config;
    private final OcrEngine ocrEngine;
    private final PdfPageRenderer pageRenderer;
    private final AsyncTaskExecutor ocrPageExecutor;

    public OcrExtractor(IngestionConfig config, OcrEngine ocrEngine, PdfPageRenderer pageRenderer,
                        @Qualifier("ocrPageExecutor") AsyncTaskExecutor ocrPageExecutor) {
        this.config = config;
        this.ocrEngine = ocrEngine;
        this.pageRenderer = pageRenderer;
        this.ocrPageExecutor = ocrPageExecutor;
    }

    public OcrResult extract(byte[] content, Kind kind, String sourceFile, String contextInfo) {
        List<JobIssue> warnings = new ArrayList<>();
        List<ExtractedPage> pages = switch (kind) {
            case IMAGE -> List.of(extractImage(content, contextInfo, warnings));
            case PDF -> extractPdf(content, contextInfo, warnings);
            case CSV, UNSUPPORTED -> throw new IllegalArgumentException("OCR cannot handle files of kind " + kind);
        };
        ExtractedDocument document = new ExtractedDocument(sourceFile, pages);
        checkSuccessRatio(document);
        log.info("[{}] Extracted {} of {} pages from '{}'.", contextInfo, document.okPageCount(), pages.size(),
                sourceFile);
        return new OcrResult(document, warnings);
    }

    private ExtractedPage extractImage(byte[] content, String contextInfo, List<JobIssue> warnings) {
        try {
            return new ExtractedPage(1, ocrEngine.extractText(content, contextInfo), true);
        } catch (RuntimeException e) {
            return pageFailed(1, e, contextInfo, warnings);
        }
    }

    private List<ExtractedPage> extractPdf(byte[] content, String contextInfo, List<JobIssue> warnings) {
        try (PDDocument document = Loader.loadPDF(content)) {
            int totalPages = document.getNumberOfPages();
            if (totalPages == 0) {
                throw new EmptyContentException("PDF has no pages");
            }
            int pageCount = Math.min(totalPages, config.getOcr().getMaxPages());
            if (pageCount < totalPages) {
                String message = String.format("Only the first %d of %d pages were processed.", pageCount,
                        totalPages);
                log.warn("[{}] {}", contextInfo, message);
                warnings.add(JobIssue.warning(ErrorCode.OCR_PAGES_TRUNCATED, message));
            }
            return recognizePages(document, pageCount, contextInfo, warnings);
        } catch (IOException e) {
            throw new OcrExtractionException("PDF could not be opened: " + e.getMessage(), e);
        }
    }

    private List<ExtractedPage> recognizePages(PDDocument document, int pageCount, String contextInfo,
                                               List<JobIssue> warnings) {
        PDFRenderer renderer = pageRenderer.rendererFor(document);
        Semaphore permits = new Semaphore(Math.max(1, config.getOcr().getPageConcurrency()));
        List<Future<String>> futures = new ArrayList<>(pageCount);
        List<ExtractedPage> pages = new ArrayList<>(pageCount);
        try {
            for (int index = 0; index < pageCount; index++) {
                byte[] image;
                try {
                    image = pageRenderer.renderPage(renderer, index);
                } catch (IOException | RuntimeException e) {
                    log.warn("[{}] Failed to render page {}: {}", contextInfo, index + 1, e.getMessage());
                    futures.add(null);
                    continue;
                }
                permits.acquire();
                try {
                    futures.add(ocrPageExecutor.submit(() -> {
                        try {
                            return ocrEngine.extractText(image, contextInfo);
                        } finally {
                            permits.release();
                        }
                    }));
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
            }
            for (int index = 0; index < pageCount; index++) {
                int pageNumber = index + 1;
                Future<String> future = futures.get(index);
                if (future == null) {
                    pages.add(pageFailed(pageNumber, new IOException("page could not be rendered"), contextInfo,
                            warnings));
                    continue;
                }
                try {
                    pages.add(new ExtractedPage(pageNumber, future.get(), true));
                } catch (ExecutionException e) {
                    pages.add(pageFailed(pageNumber, e.getCause(), contextInfo, warnings));
                }
            }
            return pages;
        } catch (InterruptedException e) {
            futures.stream().filter(Objects::nonNull).forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new OcrExtractionException("OCR was interrupted", e);
        }
    }

    private ExtractedPage pageFailed(int pageNumber, Throwable cause, String contextInfo, List<JobIssue> warnings) {
        String message = String.format("Page %d could not be extracted: %s", pageNumber, cause.getMessage());
        log.warn("[{}] {}", contextInfo, message);
        warnings.add(JobIssue.warning(ErrorCode.OCR_PAGE_FAILURE, message));
        return ExtractedPage.failed(pageNumber);
    }

    private void checkSuccessRatio(ExtractedDocument document) {
        double minRatio = config.getOcr().getMinSuccessRatio();
        double ratio = (double) document.okPageCount() / document.pages().size();
        if (ratio < minRatio) {
            throw new OcrExtractionException(String.format("Only %d of %d pages were extracted, below the required ratio %.2f",
                    document.okPageCount(), document.pages().size(), minRatio));
        }
    }
}
