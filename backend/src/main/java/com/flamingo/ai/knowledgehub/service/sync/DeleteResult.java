package com.flamingo.ai.knowledgehub.service.sync;

/** Rows and index chunks removed when a table's synced records are deleted. */
public record DeleteResult(int deleted, long deletedChunks) {}
