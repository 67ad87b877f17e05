package com.phillippitts.docingest.service.monitor;

import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;

/**
 * Client of the status endpoint.
 */
public interface StatusClient {

    /**
     * @throws AuthFailureException when the credential is rejected
     * @throws TransferException on transport failure; the monitor retries on the next tick
     */
    ProcessingStatus status(String uploadId);
}
