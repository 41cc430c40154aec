package com.chatbridge.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BusinessReply(
    String reply,
    Integer leadScore,
    String category
) {}
