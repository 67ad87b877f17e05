/**
 * Per-file validation applied before an item enters the ingestion pipeline.
 */
package com.phillippitts.docingest.service.validation;
