package com.eyelevel.tableingestor.service.ocr;

import com.eyelevel.tableingestor.common.processexec.ProcessExecutor;
import com.eyelevel.tableingestor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.OcrExtractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the {@code tesseract} CLI on one image. The image is written to a private temp directory and
 * tesseract writes its result to {@code <base>.txt} next to it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TesseractOcrEngine implements OcrEngine {

    private final IngestionConfig config;
    private final ProcessExecutor processExecutor;

    @Override
    public String extractText(byte[] imageBytes, String contextInfo) {
        IngestionConfig.Ocr ocr = config.getOcr();
        Path tempDir = null;
        try {
            tempDir = Files.createTempDirectory("ocr-");
            Path input = tempDir.resolve("page.img");
            Path outputBase = tempDir.resolve("page");
            Files.write(input, imageBytes);

            List<String> command = List.of(ocr.getCommand(), input.toString(), outputBase.toString(),
                    "-l", ocr.getLanguage(), "--psm", String.valueOf(ocr.getPageSegmentationMode()));
            ProcessResult result = processExecutor.execute(command, contextInfo, ocr.getPageTimeout(), "tesseract");
            if (result.exitCode() != 0) {
                throw new OcrExtractionException(String.format("tesseract exited with code %d: %s",
                        result.exitCode(), result.stderr()));
            }
            Path output = tempDir.resolve("page.txt");
            if (!Files.exists(output)) {
                throw new OcrExtractionException("tesseract produced no output file");
            }
            return Files.readString(output, StandardCharsets.UTF_8);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrExtractionException("OCR was interrupted", e);
        } catch (IOException e) {
            throw new OcrExtractionException("OCR process failed: " + e.getMessage(), e);
        } finally {
            if (tempDir != null) {
                try {
                    FileUtils.deleteDirectory(tempDir.toFile());
                } catch (IOException e) {
                    log.warn("[{}] Failed to clean up OCR temp dir: {}", contextInfo, tempDir);
                }
            }
        }
    }
}
