package com.mk.fx.qa.burst.rest;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
