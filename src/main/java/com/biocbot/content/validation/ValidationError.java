package com.biocbot.content.validation;

public record ValidationError(String code, String field, String message) {}
