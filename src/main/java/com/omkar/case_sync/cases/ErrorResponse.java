package com.omkar.case_sync.cases;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.omkar.case_sync.shared.ErrorDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String title;
    private String detail;
    private String version;
    @JsonProperty("error_messages")
    private List<String> errorMessages;

    public static ErrorResponse from(ErrorDetail error) {
        return ErrorResponse.builder()
                .title(error.getTitle())
                .detail(error.getDetail())
                .version(error.getVersion())
                .errorMessages(error.getErrorMessages())
                .build();
    }

    public static ErrorResponse internalError() {
        return ErrorResponse.builder()
                .title("Internal Server Error")
                .detail("An unexpected error occurred")
                .version(ErrorDetail.VERSION)
                .errorMessages(List.of())
                .build();
    }
}
