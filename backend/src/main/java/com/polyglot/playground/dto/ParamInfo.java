package com.polyglot.playground.dto;

public record ParamInfo(String name, String dataType) {
}
