/**
 * Processing phase: per-item status polling with a bounded attempt count.
 */
package com.phillippitts.docingest.service.monitor;
