/*
 * Copyright (C) 2025 Glencoe Software, Inc. All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.glencoesoftware.brim.exceptions;

import java.io.IOException;

/**
 * Base class of every failure surfaced by the brim access layer. None of
 * these are retried; they signal either a programming error (bad index, wrong
 * mode) or a data error that retrying cannot fix.
 */
public class BrimException extends IOException {

    private static final long serialVersionUID = 1L;

    public BrimException(String message) {
        super(message);
    }

    public BrimException(String message, Throwable cause) {
        super(message, cause);
    }
}
