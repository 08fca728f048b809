package com.codeheadsystems.coffer.client;

import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.accessor.OAuthAccessor;
import com.codeheadsystems.coffer.client.accessor.PublicAccessor;
import com.codeheadsystems.coffer.client.accessor.RetryingHttpExecutor;
import com.codeheadsystems.coffer.client.config.CofferClientConfig;
import com.codeheadsystems.coffer.client.manager.ChunkedTransfer;
import com.codeheadsystems.coffer.client.manager.PublicShareDownloadManager;
import com.codeheadsystems.coffer.client.manager.PublicShareUploadManager;
import com.codeheadsystems.coffer.client.manager.UploadStatusPoller;
import java.time.Clock;

/**
 * The parts of the object graph that outlive a single connection. Passed unchanged from one
 * session state to the next.
 */
record ClientContext(CofferClientConfig config,
                     RetryingHttpExecutor executor,
                     OAuthAccessor oauthAccessor,
                     PublicAccessor publicAccessor,
                     ContentAccessor contentAccessor,
                     ChunkedTransfer chunkedTransfer,
                     UploadStatusPoller poller,
                     PublicShareUploadManager publicShareUploadManager,
                     PublicShareDownloadManager publicShareDownloadManager,
                     Clock clock) {

  static ClientContext create(final CofferClientConfig config,
                              final RetryingHttpExecutor executor,
                              final UploadStatusPoller poller,
                              final Clock clock) {
    ContentAccessor contentAccessor = new ContentAccessor(executor);
    PublicAccessor publicAccessor = new PublicAccessor(config, executor);
    ChunkedTransfer chunkedTransfer = new ChunkedTransfer(contentAccessor);
    return new ClientContext(config, executor, new OAuthAccessor(config, executor), publicAccessor,
        contentAccessor, chunkedTransfer, poller,
        new PublicShareUploadManager(config, publicAccessor, chunkedTransfer, poller),
        new PublicShareDownloadManager(config, publicAccessor, contentAccessor), clock);
  }
}
