package com.eyelevel.tableingestor.model;

import java.util.List;

/**
 * Text extracted from an image or PDF, page by page, in page order.
 *
 * @param sourceFile the object key the document was read from.
 * @param pages      contiguous page slots starting at 1.
 */
public record ExtractedDocument(String sourceFile, List<ExtractedPage> pages) {

    public long okPageCount() {
        return pages.stream().filter(ExtractedPage::ok).count();
    }
}
