/**
 * The externally-visible document list and the backend calls that feed and prune it.
 */
package com.phillippitts.docingest.service.registry;
