package com.eyelevel.tableingestor.model;

/**
 * One page slot of an {@link ExtractedDocument}. A failed page keeps its slot with empty text.
 *
 * @param pageNumber 1-based page number.
 * @param text       the extracted text, empty when {@code ok} is false.
 * @param ok         whether extraction succeeded for this page.
 */
public record ExtractedPage(int pageNumber, String text, boolean ok) {

    public static ExtractedPage failed(int pageNumber) {
        return new ExtractedPage(pageNumber, "", false);
    }
}
