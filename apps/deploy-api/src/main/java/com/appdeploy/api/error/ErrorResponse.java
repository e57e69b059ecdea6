package com.appdeploy.api.error;

public record ErrorResponse(String detail) {
}
