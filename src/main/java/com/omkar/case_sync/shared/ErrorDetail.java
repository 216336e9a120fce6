package com.omkar.case_sync.shared;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured failure carried by {@link Result}.
 * Mirrors the error body the Intempus integration exposes to callers: an
 * HTTP-equivalent status, a short title, a human-readable detail and the
 * individual messages reported upstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorDetail {
    public static final String VERSION = "1.0.0";

    private ErrorKind kind;
    private int statusCode;
    private String title;
    private String detail;
    @Builder.Default
    private String version = VERSION;
    @Builder.Default
    private List<String> errorMessages = new ArrayList<>();

    public static ErrorDetail upstreamStatus(int status, String body) {
        return ErrorDetail.builder()
                .kind(ErrorKind.UPSTREAM_STATUS)
                .statusCode(status)
                .title(titleFor(status))
                .detail("Upstream API returned status " + status)
                .errorMessages(List.of(body != null ? body : ""))
                .build();
    }

    public static ErrorDetail transport(Exception cause) {
        return ErrorDetail.builder()
                .kind(ErrorKind.TRANSPORT)
                .statusCode(503)
                .title("Network Error")
                .detail(String.valueOf(cause.getMessage()))
                .errorMessages(List.of("Could not reach upstream API"))
                .build();
    }

    public static ErrorDetail unreadableResponse(Exception cause) {
        return ErrorDetail.builder()
                .kind(ErrorKind.UPSTREAM_STATUS)
                .statusCode(502)
                .title("Bad Gateway")
                .detail("Upstream API returned an unreadable response")
                .errorMessages(List.of(String.valueOf(cause.getMessage())))
                .build();
    }

    public static ErrorDetail localStore(Exception cause) {
        return ErrorDetail.builder()
                .kind(ErrorKind.LOCAL_STORE)
                .statusCode(500)
                .title("Local Store Error")
                .detail(String.valueOf(cause.getMessage()))
                .build();
    }

    public static ErrorDetail validation(List<String> messages) {
        return ErrorDetail.builder()
                .kind(ErrorKind.VALIDATION)
                .statusCode(400)
                .title("Bad Request")
                .detail("Request validation failed")
                .errorMessages(new ArrayList<>(messages))
                .build();
    }

    public static ErrorDetail internal(Exception cause) {
        return ErrorDetail.builder()
                .kind(ErrorKind.INTERNAL)
                .statusCode(500)
                .title("Internal Server Error")
                .detail(String.valueOf(cause.getMessage()))
                .build();
    }

    public boolean isNotFound() {
        return kind == ErrorKind.UPSTREAM_STATUS && statusCode == 404;
    }

    static String titleFor(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            default -> "HTTP " + status;
        };
    }
}
