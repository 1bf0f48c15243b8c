package com.shelfmark.app.database;

public record JobErrorRow(long id, long jobId, String filePath, String errorType, String errorMessage, long createdAt) {}
