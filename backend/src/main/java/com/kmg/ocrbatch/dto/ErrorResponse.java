package com.kmg.ocrbatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kmg.ocrbatch.model.ErrorKind;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, ErrorKind kind, String message) {
}
