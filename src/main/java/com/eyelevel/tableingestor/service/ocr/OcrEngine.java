package com.eyelevel.tableingestor.service.ocr;

/**
 * Text extraction capability for a single image. Each call fails independently.
 */
public interface OcrEngine {

    /**
     * @param imageBytes an encoded image (PNG, JPEG, TIFF, ...).
     * @param contextInfo logging context, e.g. the job id.
     * @return the recognized text, possibly empty.
     * @throws com.eyelevel.tableingestor.exception.OcrExtractionException when the engine fails on this image.
     */
    String extractText(byte[] imageBytes, String contextInfo);
}
