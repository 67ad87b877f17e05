/**
 * Transfer phase: one {@link com.phillippitts.docingest.service.transfer.UploadTask} per item,
 * throttled progress reporting and the size-scaled transfer deadline.
 */
package com.phillippitts.docingest.service.transfer;
