/*
 * Copyright (c) 2023.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.hydresgeo.hprocessing.core;

/**
 * Base class of all errors raised by the region extraction and calibration pipeline.
 * None of them is caught inside the pipeline.
 */
public class HProcessingException extends RuntimeException {

    public HProcessingException(String message) {
        super(message);
    }

    public HProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
