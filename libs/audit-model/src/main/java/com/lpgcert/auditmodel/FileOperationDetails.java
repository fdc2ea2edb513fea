package com.lpgcert.auditmodel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Payload of {@code file_operation} events (uploads, deletions, downloads).
 *
 * @param fileName name of the file, required
 * @param fileSize size in bytes, nullable
 * @param fileType MIME type, nullable
 * @param filePath storage path or bucket key, nullable
 * @param extra extension fields
 */
public record FileOperationDetails(
        String fileName, Long fileSize, String fileType, String filePath, Map<String, Object> extra)
        implements AuditDetails {

    public static final String FILE_NAME = "file_name";
    public static final String FILE_SIZE = "file_size";
    public static final String FILE_TYPE = "file_type";
    public static final String FILE_PATH = "file_path";

    private static final Set<String> TYPED_KEYS = Set.of(FILE_NAME, FILE_SIZE, FILE_TYPE, FILE_PATH);

    public FileOperationDetails {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be null or blank");
        }
        extra = DetailMaps.copyOf(extra);
    }

    public static FileOperationDetails of(String fileName, Long fileSize, String fileType, String filePath) {
        return new FileOperationDetails(fileName, fileSize, fileType, filePath, Map.of());
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(FILE_NAME, fileName);
        DetailMaps.putIfPresent(map, FILE_SIZE, fileSize);
        DetailMaps.putIfPresent(map, FILE_TYPE, fileType);
        DetailMaps.putIfPresent(map, FILE_PATH, filePath);
        return DetailMaps.withExtra(map, extra);
    }

    static FileOperationDetails fromMap(Map<String, Object> values) {
        String name = DetailMaps.string(values, FILE_NAME);
        return new FileOperationDetails(
                name == null || name.isBlank() ? "unknown" : name,
                DetailMaps.number(values, FILE_SIZE),
                DetailMaps.string(values, FILE_TYPE),
                DetailMaps.string(values, FILE_PATH),
                DetailMaps.remaining(values, TYPED_KEYS));
    }
}
