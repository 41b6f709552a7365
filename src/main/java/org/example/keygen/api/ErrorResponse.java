package org.example.keygen.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("request_id") String requestId
) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
