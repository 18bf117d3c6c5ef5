package com.modelguard.modelguard.common;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(int status, String error, String code, String message, String path, long timestamp) {
}
