package com.phillippitts.docingest.service.detect;

import com.phillippitts.docingest.exception.AuthFailureException;
import com.phillippitts.docingest.exception.TransferException;

/**
 * Client of the external classification endpoint.
 */
public interface DocumentClassifier {

    /**
     * Classifies a file by its content.
     *
     * @param fileName original file name (some classifiers use it as a hint)
     * @param content file bytes
     * @return category key, or {@code null} when the classifier does not recognize the file
     * @throws AuthFailureException when the credential is rejected
     * @throws TransferException when the call fails
     */
    String classify(String fileName, byte[] content);
}
