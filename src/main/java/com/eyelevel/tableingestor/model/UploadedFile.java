package com.eyelevel.tableingestor.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.io.FilenameUtils;

import java.util.Arrays;
import java.util.Locale;

/**
 * A fetched object together with the metadata the pipeline needs. Immutable once fetched.
 */
@Value
@Builder
public class UploadedFile {
    String bucket;
    String key;
    String declaredContentType;
    long sizeBytes;
    String contentHash;
    byte[] content;

    public String fileName() {
        return FilenameUtils.getName(key);
    }

    public String extension() {
        return FilenameUtils.getExtension(fileName()).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns at most {@code length} leading bytes of the content.
     */
    public byte[] prefix(int length) {
        if (content == null) {
            return new byte[0];
        }
        return Arrays.copyOf(content, Math.min(length, content.length));
    }
}
