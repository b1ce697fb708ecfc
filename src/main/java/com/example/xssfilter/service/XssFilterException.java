package com.example.xssfilter.service;

import lombok.Getter;

public class XssFilterException extends RuntimeException {

    public enum Code {
        NOT_JSON,
        MALFORMED_FORM,
        EMPTY_PART,
        MALFORMED_MULTIPART,
        UNSUPPORTED_VALUE_SHAPE
    }

    @Getter
    private final Code code;

    private XssFilterException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static XssFilterException notJson(Throwable cause) {
        return new XssFilterException(Code.NOT_JSON, "Body is not valid JSON", cause);
    }

    public static XssFilterException malformedForm(String detail) {
        return new XssFilterException(Code.MALFORMED_FORM,
                "Form data could not be decoded: " + detail, null);
    }

    public static XssFilterException emptyPart(String fieldName) {
        return new XssFilterException(Code.EMPTY_PART,
                "Multipart section " + fieldName + " has no content", null);
    }

    public static XssFilterException malformedMultipart(String detail, Throwable cause) {
        return new XssFilterException(Code.MALFORMED_MULTIPART,
                "Multipart body could not be read: " + detail, cause);
    }

    public static XssFilterException unsupportedValueShape(String found) {
        return new XssFilterException(Code.UNSUPPORTED_VALUE_SHAPE,
                "JSON root must be an object or an array of objects, found " + found, null);
    }
}
