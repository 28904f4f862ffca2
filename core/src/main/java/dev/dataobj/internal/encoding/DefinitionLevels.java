/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.encoding;

/**
 * Definition levels recorded per row of a page.
 */
public final class DefinitionLevels {

    /**
     * No value was written for the row.
     */
    public static final int NIL = 0;

    /**
     * An empty value (for example a zero-length byte array) was written; it has no bytes in the values section.
     */
    public static final int EMPTY = 1;

    /**
     * A value was written and is stored in the values section.
     */
    public static final int PRESENT = 2;

    public static final int BIT_WIDTH = 2;

    private DefinitionLevels() {
    }
}
