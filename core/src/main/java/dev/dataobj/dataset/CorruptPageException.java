/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.dataset;

import java.io.IOException;

/**
 * Thrown when a page cannot be decompressed or decoded.
 */
public class CorruptPageException extends IOException {

    private final int pageIndex;

    public CorruptPageException(int pageIndex, String message) {
        super("Corrupt page " + pageIndex + ": " + message);
        this.pageIndex = pageIndex;
    }

    public CorruptPageException(int pageIndex, Throwable cause) {
        super("Corrupt page " + pageIndex + ": " + cause.getMessage(), cause);
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }
}
