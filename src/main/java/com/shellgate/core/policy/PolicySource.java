package com.shellgate.core.policy;

import java.io.IOException;

/**
 * Read access to wherever the policy document lives.
 */
public interface PolicySource {

    /**
     * Returns the raw policy document.
     *
     * @throws IOException if the underlying medium cannot be read
     */
    byte[] read() throws IOException;

    /** Human-readable location, used in logs and in {@link PolicySnapshot#source()}. */
    String describe();
}
