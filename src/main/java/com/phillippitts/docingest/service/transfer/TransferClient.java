package com.phillippitts.docingest.service.transfer;

import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;

/**
 * Client of the transfer endpoint.
 */
public interface TransferClient {

    /**
     * Observer of byte-level transfer progress.
     */
    @FunctionalInterface
    interface ProgressListener {
        void onBytesSent(long bytesSent, long totalBytes);
    }

    /**
     * Uploads one file, blocking until the backend responds. Implementations must stop promptly
     * when the calling thread is interrupted.
     *
     * @throws AuthFailureException when the credential is rejected
     * @throws TransferException on network errors, aborts and unexpected responses
     */
    TransferReceipt transfer(TransferRequest request, ProgressListener progress);
}
