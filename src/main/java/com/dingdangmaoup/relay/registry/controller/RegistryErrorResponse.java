package com.dingdangmaoup.relay.registry.controller;

import lombok.Value;

import java.util.List;

/**
 * Registry V2 error body: {@code {"errors":[{"code":"...","message":"..."}]}}
 */
@Value
public class RegistryErrorResponse {
    List<Error> errors;

    public static RegistryErrorResponse of(String code, String message) {
        return new RegistryErrorResponse(List.of(new Error(code, message)));
    }

    @Value
    public static class Error {
        String code;
        String message;
    }
}
