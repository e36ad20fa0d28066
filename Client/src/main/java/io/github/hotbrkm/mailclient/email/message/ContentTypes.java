package io.github.hotbrkm.mailclient.email.message;

import java.util.Locale;

public final class ContentTypes {

    public static final String TEXT_PLAIN = "text/plain";
    public static final String TEXT_HTML = "text/html";
    public static final String TEXT_CALENDAR = "text/calendar";
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";
    public static final String APPLICATION_PKCS7_MIME = "application/pkcs7-mime";
    public static final String MULTIPART_MIXED = "mixed";
    public static final String MULTIPART_RELATED = "related";
    public static final String MULTIPART_ALTERNATIVE = "alternative";

    private ContentTypes() {
    }

    /**
     * Guesses the content type of a file from its extension.
     */
    public static String fromFileName(String fileName) {
        if (fileName == null) {
            return APPLICATION_OCTET_STREAM;
        }
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex == -1) {
            return APPLICATION_OCTET_STREAM;
        }
        String extension = fileName.substring(dotIndex).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case ".txt" -> TEXT_PLAIN;
            case ".html", ".htm" -> TEXT_HTML;
            case ".ics" -> TEXT_CALENDAR;
            case ".csv" -> "text/csv";
            case ".xml" -> "application/xml";
            case ".json" -> "application/json";
            case ".pdf" -> "application/pdf";
            case ".zip" -> "application/zip";
            case ".jpg", ".jpeg" -> "image/jpeg";
            case ".png" -> "image/png";
            case ".gif" -> "image/gif";
            case ".svg" -> "image/svg+xml";
            case ".p7m" -> APPLICATION_PKCS7_MIME;
            case ".eml" -> "message/rfc822";
            default -> APPLICATION_OCTET_STREAM;
        };
    }
}
