/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.sketch;

import java.io.EOFException;

/**
 * Thrown when a serialized sketch ends before all of its declared content was read.
 */
public class SketchTooShortException extends EOFException {

    public SketchTooShortException(String what, int needed, int available) {
        super("Serialized sketch too short reading " + what + ": need " + needed + " bytes, have " + available);
    }
}
