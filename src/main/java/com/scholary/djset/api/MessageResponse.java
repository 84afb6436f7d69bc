package com.scholary.djset.api;

public record MessageResponse(String message) {}
