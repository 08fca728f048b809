package com.codeheadsystems.coffer.model.upload;

import com.codeheadsystems.coffer.model.error.ApiErrorResponse;

/**
 * Common view of the status documents returned while an object storage upload is assembled.
 */
public interface UploadStatusResponse {

  UploadState status();

  ApiErrorResponse errorDetails();
}
