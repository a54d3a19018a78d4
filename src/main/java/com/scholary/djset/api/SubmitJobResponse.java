package com.scholary.djset.api;

public record SubmitJobResponse(String message, String jobId) {}
