package com.NutriCare.diet_backend.util;

import com.NutriCare.diet_backend.exception.ApiException;
import org.springframework.http.HttpStatus;
import org.springframework.web.multipart.MultipartFile;

import java.util.Locale;

public class FileUploadUtil {

    private FileUploadUtil() {
        // Utility class, no instantiation
    }

    /**
     * Rejects anything that is not a non-empty Excel workbook within the size limit.
     */
    public static void requireSpreadsheet(MultipartFile file, long maxSizeInMB) {
        if (file == null || file.isEmpty()) {
            throw new ApiException("Uploaded file is empty", HttpStatus.BAD_REQUEST, "EMPTY_FILE");
        }
        if (!isSpreadsheet(file.getOriginalFilename())) {
            throw new ApiException("Invalid file type. Please upload an Excel file (.xlsx or .xls).",
                    HttpStatus.BAD_REQUEST, "INVALID_FILE_TYPE");
        }
        if (!isValidFileSize(file, maxSizeInMB)) {
            throw new ApiException("Uploaded file exceeds " + maxSizeInMB + " MB",
                    HttpStatus.BAD_REQUEST, "FILE_TOO_LARGE");
        }
    }

    public static boolean isSpreadsheet(String filename) {
        String extension = getFileExtension(filename).toLowerCase(Locale.ROOT);
        return ".xlsx".equals(extension) || ".xls".equals(extension);
    }

    public static boolean isValidFileSize(MultipartFile file, long maxSizeInMB) {
        long maxSizeInBytes = maxSizeInMB * 1024 * 1024;
        return file.getSize() <= maxSizeInBytes;
    }

    private static String getFileExtension(String filename) {
        if (filename == null || filename.lastIndexOf(".") == -1) {
            return "";
        }
        return filename.substring(filename.lastIndexOf("."));
    }
}
