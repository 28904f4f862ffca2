/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.dataobj.internal.compression;

/**
 * A codec that both compresses and decompresses page data.
 */
public interface PageCodec extends Compressor, Decompressor {
}
