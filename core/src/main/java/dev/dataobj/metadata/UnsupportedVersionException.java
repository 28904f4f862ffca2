/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.metadata;

import java.io.IOException;

/**
 * Thrown when serialized data carries a format version or type tag this library cannot interpret.
 */
public class UnsupportedVersionException extends IOException {

    private final int version;

    public UnsupportedVersionException(String what, int version) {
        super("Unsupported " + what + ": " + version);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
