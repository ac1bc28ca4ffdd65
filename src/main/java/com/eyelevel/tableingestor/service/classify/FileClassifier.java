package com.eyelevel.tableingestor.service.classify;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.model.Kind;
import com.eyelevel.tableingestor.model.UploadedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a {@link Kind} from the leading bytes of a file, falling back to its extension.
 * Only a bounded prefix is ever inspected, and classification never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileClassifier {

    private static final byte[] PDF = ascii("%PDF-");
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] GIF87 = ascii("GIF87a");
    private static final byte[] GIF89 = ascii("GIF89a");
    private static final byte[] TIFF_LE = {'I', 'I', '*', 0};
    private static final byte[] TIFF_BE = {'M', 'M', 0, '*'};
    private static final byte[] BMP = ascii("BM");
    private static final byte[] BMP_RESERVED = {0, 0, 0, 0};
    private static final byte[] RIFF = ascii("RIFF");
    private static final byte[] WEBP = ascii("WEBP");

    private static final Map<String, Kind> EXTENSIONS = Map.ofEntries(
            Map.entry("csv", Kind.CSV),
            Map.entry("tsv", Kind.CSV),
            Map.entry("pdf", Kind.PDF),
            Map.entry("png", Kind.IMAGE),
            Map.entry("jpg", Kind.IMAGE),
            Map.entry("jpeg", Kind.IMAGE),
            Map.entry("gif", Kind.IMAGE),
            Map.entry("tif", Kind.IMAGE),
            Map.entry("tiff", Kind.IMAGE),
            Map.entry("bmp", Kind.IMAGE),
            Map.entry("webp", Kind.IMAGE));

    private final IngestionConfig config;

    public Kind classify(UploadedFile file) {
        return classify(file.prefix(config.getClassifier().getPrefixBytes()), file.fileName());
    }

    /**
     * Classifies a file by signature first, then by extension.
     *
     * @param prefix   the first bytes of the file, may be {@code null} or shorter than any signature.
     * @param fileName the file name or object key, may be {@code null}.
     * @return the detected kind, {@link Kind#UNSUPPORTED} when nothing matches.
     */
    public Kind classify(byte[] prefix, String fileName) {
        Kind bySignature = bySignature(prefix == null ? new byte[0] : prefix);
        if (bySignature != null) {
            log.debug("Classified '{}' as {} by signature.", fileName, bySignature);
            return bySignature;
        }
        String extension = fileName == null ? "" : FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        Kind byExtension = EXTENSIONS.getOrDefault(extension, Kind.UNSUPPORTED);
        log.debug("Classified '{}' as {} by extension '{}'.", fileName, byExtension, extension);
        return byExtension;
    }

    private Kind bySignature(byte[] prefix) {
        if (startsWith(prefix, PDF, 0)) {
            return Kind.PDF;
        }
        if (startsWith(prefix, PNG, 0) || startsWith(prefix, JPEG, 0) || startsWith(prefix, GIF87, 0)
                || startsWith(prefix, GIF89, 0) || startsWith(prefix, TIFF_LE, 0) || startsWith(prefix, TIFF_BE, 0)
                || (startsWith(prefix, RIFF, 0) && startsWith(prefix, WEBP, 8))) {
            return Kind.IMAGE;
        }
        // "BM" alone collides with text; the reserved header bytes 6..9 of a bitmap are zero.
        if (startsWith(prefix, BMP, 0) && startsWith(prefix, BMP_RESERVED, 6)) {
            return Kind.IMAGE;
        }
        return null;
    }

    private static boolean startsWith(byte[] data, byte[] signature, int offset) {
        if (data.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (data[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] ascii(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }
}
