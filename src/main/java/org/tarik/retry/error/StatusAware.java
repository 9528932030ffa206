package org.tarik.retry.error;

import java.util.OptionalInt;

/**
 * Marks failures which expose the numeric status returned by the remote service.
 */
public interface StatusAware {
    OptionalInt getStatus();
}
