package com.astrobg.service;

import com.astrobg.model.ExtractionResult;

/**
 * Progress and completion callbacks. Invoked on the thread running the extraction,
 * in milestone order for a given run.
 */
public interface ExtractionListener {

    default void onStarted() {}

    default void onProgress(int percentage, String stage) {}

    default void onFinished(ExtractionResult result) {}
}
